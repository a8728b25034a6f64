package com.mwor.model;

public record QualifiedWallet(
        String wallet,
        long score,
        int rank,
        int tickets,
        TicketTier tier
) {
}
