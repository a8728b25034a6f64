package com.mwor.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Daily raffle qualification and ticket distribution settings.
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "mwor.raffle")
public class RaffleProperties {

    /**
     * Top percentage of unique wallets on today's leaderboard that qualify.
     */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private double leaderboardSlicePercent = 25.0;

    @Min(1)
    private int maxTicketsPerWallet = 25;

    @Min(1)
    private int numberOfWinners = 10;

    private InvalidSignaturePolicy invalidSignaturePolicy = InvalidSignaturePolicy.SKIP;

    private boolean scheduledDrawEnabled = false;

    /**
     * UTC cron for the scheduled draw of the previous day.
     */
    private String drawCron = "0 5 0 * * *";

    private TicketTiers ticketTiers = new TicketTiers();

    public enum InvalidSignaturePolicy {
        SKIP,
        REJECT
    }

    @Getter
    @Setter
    public static class TicketTiers {
        private int rank1 = 25;
        private int ranks2to5 = 15;
        private int ranks6to10 = 10;
        private int remaining = 1;
    }
}
