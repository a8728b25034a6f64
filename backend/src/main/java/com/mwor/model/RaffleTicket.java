package com.mwor.model;

public record RaffleTicket(
        String walletAddress,
        long ticketNumber,
        TicketTier tier,
        long score,
        int rank
) {
}
