package com.mwor.error;

import lombok.Getter;

@Getter
public class FairnessException extends RuntimeException {

    private final FairnessErrorCode errorCode;

    public FairnessException(FairnessErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public FairnessException(FairnessErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getCode() {
        return errorCode.code();
    }

    public static FairnessException sessionNotFound(String sessionId) {
        return new FairnessException(
                FairnessErrorCode.SESSION_NOT_FOUND,
                "Session " + sessionId + " not found"
        );
    }

    public static FairnessException sessionEnded(String sessionId) {
        return new FairnessException(
                FairnessErrorCode.SESSION_ENDED,
                "Session " + sessionId + " has already been exported and accepts no more pieces"
        );
    }

    public static FairnessException sessionIdReused(String sessionId) {
        return new FairnessException(
                FairnessErrorCode.SESSION_ENDED,
                "Session " + sessionId + " has already ended and cannot be started again"
        );
    }

    public static FairnessException sessionAlreadyCompleted(String sessionId) {
        return new FairnessException(
                FairnessErrorCode.SESSION_ENDED,
                "Session " + sessionId + " has already been completed"
        );
    }

    public static FairnessException seedNotCommitted(String sessionId) {
        return new FairnessException(
                FairnessErrorCode.SEED_NOT_COMMITTED,
                "No seed commitment exists for session " + sessionId
        );
    }

    public static FairnessException seedAlreadyRevealed(String sessionId) {
        return new FairnessException(
                FairnessErrorCode.SEED_ALREADY_REVEALED,
                "Seed for session " + sessionId + " was already revealed"
        );
    }

    public static FairnessException revealBeforeSessionEnd(String sessionId) {
        return new FairnessException(
                FairnessErrorCode.REVEAL_BEFORE_SESSION_END,
                "Seed for session " + sessionId + " cannot be revealed before the session has ended"
        );
    }

    public static FairnessException pieceIndexOutOfOrder(String sessionId, long expected, long actual) {
        return new FairnessException(
                FairnessErrorCode.PIECE_INDEX_OUT_OF_ORDER,
                "Session " + sessionId + " expected piece index " + expected + " but found " + actual
        );
    }

    public static FairnessException oracleUnavailable(String detail, Throwable cause) {
        return new FairnessException(
                FairnessErrorCode.ORACLE_UNAVAILABLE,
                "VRF oracle unavailable: " + detail,
                cause
        );
    }

    public static FairnessException signatureInvalid(String walletAddress) {
        return new FairnessException(
                FairnessErrorCode.SIGNATURE_INVALID,
                "Score signature is invalid for wallet " + walletAddress
        );
    }

    public static FairnessException emptyQualificationSet(String detail) {
        return new FairnessException(
                FairnessErrorCode.EMPTY_QUALIFICATION_SET,
                detail
        );
    }
}
