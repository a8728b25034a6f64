package com.mwor.scheduler;

import com.mwor.config.MworRuntimeProperties;
import com.mwor.config.RaffleProperties;
import com.mwor.error.FairnessException;
import com.mwor.model.DailyRaffleResult;
import com.mwor.model.RaffleDrawResult;
import com.mwor.service.CommitRevealManager;
import com.mwor.service.DailyRaffleOrchestrator;
import com.mwor.service.PieceGenerationEngine;
import com.mwor.service.SeedAuthority;
import com.mwor.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FairnessMaintenanceSchedulerTest {

    @Mock
    private SeedAuthority seedAuthority;

    @Mock
    private PieceGenerationEngine pieceGenerationEngine;

    @Mock
    private CommitRevealManager commitRevealManager;

    @Mock
    private DailyRaffleOrchestrator dailyRaffleOrchestrator;

    private final MworRuntimeProperties runtimeProperties = new MworRuntimeProperties();
    private final RaffleProperties raffleProperties = new RaffleProperties();
    private FairnessMaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new FairnessMaintenanceScheduler(
                runtimeProperties,
                raffleProperties,
                seedAuthority,
                pieceGenerationEngine,
                commitRevealManager,
                dailyRaffleOrchestrator,
                new MutableClock(Instant.parse("2026-03-15T00:05:00Z"))
        );
    }

    @Test
    void sweepExpiredState_cleansSessionsAndCommitments() {
        when(pieceGenerationEngine.cleanupOldSessions()).thenReturn(2);
        when(commitRevealManager.cleanupExpiredCommitments()).thenReturn(1);

        scheduler.sweepExpiredState();

        verify(pieceGenerationEngine).cleanupOldSessions();
        verify(commitRevealManager).cleanupExpiredCommitments();
    }

    @Test
    void rotateDailySeed_skipsWhenDisabled() {
        runtimeProperties.getSeed().setScheduledRotationEnabled(false);

        scheduler.rotateDailySeed();

        verifyNoInteractions(seedAuthority);
    }

    @Test
    void rotateDailySeed_logsOracleOutageInsteadOfFailingTheScheduler() {
        when(seedAuthority.rotateIfDue()).thenThrow(FairnessException.oracleUnavailable("down", null));

        assertDoesNotThrow(() -> scheduler.rotateDailySeed());
        verify(seedAuthority).rotateIfDue();
    }

    @Test
    void runDailyRaffle_isOptIn() {
        scheduler.runDailyRaffle();

        verifyNoInteractions(dailyRaffleOrchestrator);
    }

    @Test
    void runDailyRaffle_drawsThePreviousUtcDay() {
        raffleProperties.setScheduledDrawEnabled(true);
        LocalDate yesterday = LocalDate.of(2026, 3, 14);
        RaffleDrawResult draw = new RaffleDrawResult(List.of(), "00", "sig", 0, "root", Instant.EPOCH, true);
        when(dailyRaffleOrchestrator.executeDailyRaffle(yesterday))
                .thenReturn(new DailyRaffleResult(yesterday, List.of(), "root", null, draw));

        scheduler.runDailyRaffle();

        verify(dailyRaffleOrchestrator).executeDailyRaffle(yesterday);
    }

    @Test
    void runDailyRaffle_toleratesDaysWithoutQualifiers() {
        raffleProperties.setScheduledDrawEnabled(true);
        when(dailyRaffleOrchestrator.executeDailyRaffle(LocalDate.of(2026, 3, 14)))
                .thenThrow(FairnessException.emptyQualificationSet("nobody played"));

        assertDoesNotThrow(() -> scheduler.runDailyRaffle());
    }
}
