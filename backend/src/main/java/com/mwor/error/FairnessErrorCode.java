package com.mwor.error;

public enum FairnessErrorCode {
    SESSION_NOT_FOUND("session_not_found"),
    SESSION_ENDED("session_ended"),
    SEED_NOT_COMMITTED("seed_not_committed"),
    SEED_ALREADY_REVEALED("seed_already_revealed"),
    REVEAL_BEFORE_SESSION_END("reveal_before_session_end"),
    PIECE_INDEX_OUT_OF_ORDER("piece_index_out_of_order"),
    ORACLE_UNAVAILABLE("oracle_unavailable"),
    SIGNATURE_INVALID("signature_invalid"),
    EMPTY_QUALIFICATION_SET("empty_qualification_set");

    private final String code;

    FairnessErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
