package com.mwor.support;

import com.mwor.config.CommitSecurityProperties;
import com.mwor.config.MworRuntimeProperties;
import com.mwor.config.RaffleProperties;
import com.mwor.config.ScoreSigningProperties;
import com.mwor.oracle.MockVrfOracleClient;
import com.mwor.oracle.VrfOracleClient;
import com.mwor.repository.InMemoryCommitmentRepository;
import com.mwor.repository.InMemoryPlayRecordStore;
import com.mwor.repository.InMemoryVrfSessionStore;
import com.mwor.service.AbuseDetector;
import com.mwor.service.CommitRevealManager;
import com.mwor.service.DailyRaffleOrchestrator;
import com.mwor.service.GameCompletionService;
import com.mwor.service.PieceGenerationEngine;
import com.mwor.service.PlayAuditService;
import com.mwor.service.RaffleDrawManager;
import com.mwor.service.RaffleTicketManager;
import com.mwor.service.ScoreSigningManager;
import com.mwor.service.SeedAuthority;
import com.mwor.service.SeedEnvelopeCryptoService;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the fairness services by hand on top of in-memory stores and a controllable clock.
 */
public class FairnessFixtures implements AutoCloseable {

    public static final Instant START = Instant.parse("2026-03-14T12:00:00Z");
    public static final String RFC8032_SECRET = "9d61b19deffd5a60ba844af492ec2cc44449c5697b326919703bac031cae7f60";

    public final MutableClock clock = new MutableClock(START);
    public final MworRuntimeProperties runtimeProperties = new MworRuntimeProperties();
    public final RaffleProperties raffleProperties = new RaffleProperties();
    public final CommitSecurityProperties commitSecurityProperties = new CommitSecurityProperties();
    public final ScoreSigningProperties signingProperties = new ScoreSigningProperties();
    public final ExecutorService oracleExecutor = Executors.newSingleThreadExecutor();

    public final InMemoryCommitmentRepository commitmentRepository = new InMemoryCommitmentRepository();
    public final InMemoryVrfSessionStore sessionStore = new InMemoryVrfSessionStore();
    public final InMemoryPlayRecordStore playRecordStore = new InMemoryPlayRecordStore();

    public final SeedAuthority seedAuthority;
    public final SeedEnvelopeCryptoService envelopeCryptoService;
    public final CommitRevealManager commitRevealManager;
    public final PieceGenerationEngine pieceGenerationEngine;
    public final ScoreSigningManager scoreSigningManager;
    public final AbuseDetector abuseDetector;
    public final PlayAuditService playAuditService;
    public final RaffleTicketManager raffleTicketManager;
    public final RaffleDrawManager raffleDrawManager;
    public final GameCompletionService gameCompletionService;
    public final DailyRaffleOrchestrator dailyRaffleOrchestrator;

    public FairnessFixtures() {
        this(new MockVrfOracleClient());
    }

    public FairnessFixtures(VrfOracleClient oracleClient) {
        runtimeProperties.getSeed().setOracleInitialBackoffMs(0);
        runtimeProperties.getSeed().setOracleTimeoutMs(2_000);
        signingProperties.setPrivateKeyHex(RFC8032_SECRET);

        seedAuthority = new SeedAuthority(oracleClient, runtimeProperties, oracleExecutor, clock);
        envelopeCryptoService = new SeedEnvelopeCryptoService(commitSecurityProperties);
        commitRevealManager = new CommitRevealManager(
                seedAuthority, commitmentRepository, envelopeCryptoService, commitSecurityProperties, clock);
        pieceGenerationEngine = new PieceGenerationEngine(commitRevealManager, sessionStore, runtimeProperties, clock);
        scoreSigningManager = new ScoreSigningManager(signingProperties, clock);
        abuseDetector = new AbuseDetector(runtimeProperties);
        playAuditService = new PlayAuditService();
        raffleTicketManager = new RaffleTicketManager(raffleProperties, scoreSigningManager);
        raffleDrawManager = new RaffleDrawManager(clock);
        gameCompletionService = new GameCompletionService(
                pieceGenerationEngine,
                commitRevealManager,
                scoreSigningManager,
                abuseDetector,
                playAuditService,
                playRecordStore
        );
        dailyRaffleOrchestrator = new DailyRaffleOrchestrator(
                playRecordStore, raffleTicketManager, raffleDrawManager, seedAuthority, raffleProperties);
    }

    @Override
    public void close() {
        oracleExecutor.shutdownNow();
    }
}
