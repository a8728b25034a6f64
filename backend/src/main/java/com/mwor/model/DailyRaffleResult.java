package com.mwor.model;

import java.time.LocalDate;
import java.util.List;

public record DailyRaffleResult(
        LocalDate day,
        List<RaffleQualification> qualifications,
        String merkleRoot,
        TicketDistribution ticketDistribution,
        RaffleDrawResult drawResult
) {
}
