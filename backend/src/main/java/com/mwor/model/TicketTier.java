package com.mwor.model;

/**
 * Rank bucket that decides a qualified wallet's base ticket count.
 */
public enum TicketTier {
    RANK1("rank1"),
    RANKS_2_TO_5("ranks2to5"),
    RANKS_6_TO_10("ranks6to10"),
    REMAINING("remaining");

    private final String code;

    TicketTier(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static TicketTier forRank(int rank) {
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be 1-based, got " + rank);
        }
        if (rank == 1) {
            return RANK1;
        }
        if (rank <= 5) {
            return RANKS_2_TO_5;
        }
        if (rank <= 10) {
            return RANKS_6_TO_10;
        }
        return REMAINING;
    }
}
