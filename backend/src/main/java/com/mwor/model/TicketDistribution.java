package com.mwor.model;

public record TicketDistribution(
        long rank1Tickets,
        long ranks2to5Tickets,
        long ranks6to10Tickets,
        long remainingTickets,
        long totalTickets
) {
}
