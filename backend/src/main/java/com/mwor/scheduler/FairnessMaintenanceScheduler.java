package com.mwor.scheduler;

import com.mwor.config.MworRuntimeProperties;
import com.mwor.config.RaffleProperties;
import com.mwor.error.FairnessException;
import com.mwor.model.DailyRaffleResult;
import com.mwor.service.CommitRevealManager;
import com.mwor.service.DailyRaffleOrchestrator;
import com.mwor.service.PieceGenerationEngine;
import com.mwor.service.SeedAuthority;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

@Service
@RequiredArgsConstructor
public class FairnessMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(FairnessMaintenanceScheduler.class);

    private final MworRuntimeProperties runtimeProperties;
    private final RaffleProperties raffleProperties;
    private final SeedAuthority seedAuthority;
    private final PieceGenerationEngine pieceGenerationEngine;
    private final CommitRevealManager commitRevealManager;
    private final DailyRaffleOrchestrator dailyRaffleOrchestrator;
    private final Clock clock;

    @Scheduled(
            fixedRateString = "${mwor.session.cleanup-interval-ms:300000}",
            initialDelayString = "${mwor.session.cleanup-initial-delay-ms:60000}"
    )
    public void sweepExpiredState() {
        int sessions = pieceGenerationEngine.cleanupOldSessions();
        int commitments = commitRevealManager.cleanupExpiredCommitments();
        if (sessions > 0 || commitments > 0) {
            log.info("Maintenance sweep: sessionsEvicted={}, commitmentsRemoved={}", sessions, commitments);
        } else {
            log.debug("Maintenance sweep completed with nothing to evict");
        }
    }

    @Scheduled(cron = "${mwor.seed.rotation-cron:0 0 0 * * *}", zone = "UTC")
    public void rotateDailySeed() {
        if (!runtimeProperties.getSeed().isScheduledRotationEnabled()) {
            return;
        }
        try {
            seedAuthority.rotateIfDue();
        } catch (FairnessException ex) {
            log.error("Scheduled seed rotation failed ({}); the next seed read will retry", ex.getCode(), ex);
        }
    }

    @Scheduled(cron = "${mwor.raffle.draw-cron:0 5 0 * * *}", zone = "UTC")
    public void runDailyRaffle() {
        if (!raffleProperties.isScheduledDrawEnabled()) {
            return;
        }
        LocalDate day = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1);
        try {
            DailyRaffleResult result = dailyRaffleOrchestrator.executeDailyRaffle(day);
            log.info("Scheduled raffle for {} drew {}", day, result.drawResult().winnerWallets());
        } catch (FairnessException ex) {
            log.warn("Scheduled raffle for {} did not run: {} ({})", day, ex.getMessage(), ex.getCode());
        }
    }
}
