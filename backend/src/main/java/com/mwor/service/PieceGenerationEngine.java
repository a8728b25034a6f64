package com.mwor.service;

import com.mwor.config.MworRuntimeProperties;
import com.mwor.error.FairnessException;
import com.mwor.model.Commitment;
import com.mwor.model.GeneratedPiece;
import com.mwor.model.PieceGenerationResult;
import com.mwor.model.SessionSnapshot;
import com.mwor.model.SessionState;
import com.mwor.model.TetrominoType;
import com.mwor.model.VrfSession;
import com.mwor.repository.VrfSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Per-session piece stream. Each session's master seed is bound to a committed round seed, so
 * once the round seed is revealed the whole stream can be replayed and checked piece by piece.
 */
@Service
public class PieceGenerationEngine {

    private static final Logger log = LoggerFactory.getLogger(PieceGenerationEngine.class);

    private final CommitRevealManager commitRevealManager;
    private final VrfSessionStore sessionStore;
    private final MworRuntimeProperties runtimeProperties;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public PieceGenerationEngine(
            CommitRevealManager commitRevealManager,
            VrfSessionStore sessionStore,
            MworRuntimeProperties runtimeProperties,
            Clock clock) {
        this.commitRevealManager = commitRevealManager;
        this.sessionStore = sessionStore;
        this.runtimeProperties = runtimeProperties;
        this.clock = clock;
    }

    /**
     * Commits a round seed for the session and starts it at piece index 0.
     *
     * @param sessionId optional; a random id is generated when blank
     * @throws IllegalArgumentException when the session id is already live
     * @throws FairnessException        ORACLE_UNAVAILABLE or SEED_ALREADY_REVEALED from the commit step
     */
    public SessionSnapshot initializeSession(String walletAddress, String sessionId) {
        if (!StringUtils.hasText(walletAddress)) {
            throw new IllegalArgumentException("Wallet is required");
        }
        String resolvedSessionId = StringUtils.hasText(sessionId) ? sessionId.trim() : newSessionId();
        if (sessionStore.find(resolvedSessionId).isPresent()) {
            throw new IllegalArgumentException("Session " + resolvedSessionId + " already exists");
        }

        commitRevealManager.commitSeed(walletAddress, resolvedSessionId);
        Commitment commitment = commitRevealManager.requireCommitment(resolvedSessionId);
        byte[] roundSeed = commitRevealManager.committedSeed(resolvedSessionId);
        Instant startTime = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        byte[] masterSeed = PieceDerivation.masterSeed(roundSeed, walletAddress, startTime);
        try {
            VrfSession session = new VrfSession(
                    resolvedSessionId,
                    walletAddress,
                    masterSeed,
                    FairnessCrypto.sha256Hex(masterSeed),
                    startTime,
                    commitment.getVrfSignature(),
                    commitment.isVerifiable()
            );
            if (!sessionStore.putIfAbsent(session)) {
                throw new IllegalArgumentException("Session " + resolvedSessionId + " already exists");
            }
            log.info("Initialized VRF session {} for wallet {} (verifiable={})",
                    resolvedSessionId, CommitRevealManager.abbreviate(walletAddress), session.isVerifiable());
            return session.snapshot();
        } finally {
            Arrays.fill(roundSeed, (byte) 0);
            Arrays.fill(masterSeed, (byte) 0);
        }
    }

    /**
     * Generates the next piece. Indices are strictly sequential per session.
     *
     * @throws FairnessException SESSION_NOT_FOUND for unknown or expired sessions,
     *                           SESSION_ENDED once the session has been exported
     */
    public GeneratedPiece generateNextPiece(String sessionId) {
        VrfSession session = requireSession(sessionId);
        session.acquire();
        session.lock().lock();
        try {
            return nextPieceLocked(session).toPublicView();
        } finally {
            session.lock().unlock();
            session.release();
        }
    }

    /**
     * Generates {@code count} consecutive pieces atomically with respect to other callers.
     */
    public List<GeneratedPiece> generatePieceSequence(String sessionId, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive");
        }
        VrfSession session = requireSession(sessionId);
        session.acquire();
        session.lock().lock();
        try {
            List<GeneratedPiece> pieces = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                pieces.add(nextPieceLocked(session).toPublicView());
            }
            return pieces;
        } finally {
            session.lock().unlock();
            session.release();
        }
    }

    /**
     * Recomputes type and proof from the disclosed {@code seedUsed}. Returns false for any
     * malformed input.
     */
    public boolean verifyPieceGeneration(PieceGenerationResult piece) {
        if (piece == null || piece.pieceType() == null || piece.proof() == null) {
            return false;
        }
        try {
            byte[] seed = FairnessCrypto.decodeHex32(piece.seedUsed());
            TetrominoType expectedType = PieceDerivation.pieceType(seed);
            if (expectedType != piece.pieceType()) {
                return false;
            }
            String expectedProof = PieceDerivation.proof(seed, piece.sessionId(), piece.pieceIndex(), expectedType);
            return FairnessCrypto.constantTimeEquals(expectedProof, piece.proof().toLowerCase());
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * Full replay check: rebuilds the master seed from the revealed round seed, checks it against
     * the snapshot's published hash and recomputes the piece at its index.
     */
    public boolean verifyPieceAgainstRevealedSeed(
            PieceGenerationResult piece,
            SessionSnapshot snapshot,
            String revealedSeed) {
        if (piece == null || snapshot == null || revealedSeed == null
                || !snapshot.sessionId().equals(piece.sessionId())) {
            return false;
        }
        try {
            byte[] roundSeed = FairnessCrypto.decodeHex32(revealedSeed);
            byte[] master = PieceDerivation.masterSeed(roundSeed, snapshot.walletAddress(), snapshot.startTime());
            if (!FairnessCrypto.constantTimeEquals(snapshot.masterSeedHash(), FairnessCrypto.sha256Hex(master))) {
                return false;
            }
            PieceGenerationResult expected = PieceDerivation.derive(master, piece.sessionId(), piece.pieceIndex());
            return expected.pieceType() == piece.pieceType()
                    && FairnessCrypto.constantTimeEquals(expected.proof(), piece.proof())
                    && (piece.seedUsed() == null
                    || FairnessCrypto.constantTimeEquals(expected.seedUsed(), piece.seedUsed().toLowerCase()));
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * Ends the session and returns its snapshot, or null when the session is unknown.
     * The commitment is marked ended so the round seed can be revealed.
     */
    public SessionSnapshot exportSessionData(String sessionId) {
        VrfSession session = sessionStore.find(sessionId).orElse(null);
        if (session == null) {
            return null;
        }
        session.acquire();
        session.lock().lock();
        try {
            if (session.getState() == SessionState.EXPIRED) {
                return null;
            }
            session.markExported();
            commitRevealManager.markSessionEnded(sessionId);
            log.info("Exported VRF session {} after {} pieces", sessionId, session.getPieceIndex());
            return session.snapshot();
        } finally {
            session.lock().unlock();
            session.release();
        }
    }

    /**
     * All pieces of an exported session including their seeds.
     *
     * @throws FairnessException SESSION_NOT_FOUND, or REVEAL_BEFORE_SESSION_END while still playing
     */
    public List<PieceGenerationResult> disclosePieces(String sessionId) {
        VrfSession session = requireSession(sessionId);
        session.lock().lock();
        try {
            if (session.getState() == SessionState.EXPIRED) {
                throw FairnessException.sessionNotFound(sessionId);
            }
            if (session.getState() != SessionState.EXPORTED) {
                throw FairnessException.revealBeforeSessionEnd(sessionId);
            }
            return session.pieces();
        } finally {
            session.lock().unlock();
        }
    }

    public Optional<SessionSnapshot> findSession(String sessionId) {
        return sessionStore.find(sessionId).map(VrfSession::snapshot);
    }

    /**
     * Evicts sessions older than the TTL. Sessions with a held lock or in-flight callers are
     * left for the next sweep.
     *
     * @return number of sessions evicted
     */
    public int cleanupOldSessions() {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(runtimeProperties.getSession().getTtlMinutes()));
        int evicted = 0;
        int skipped = 0;
        for (VrfSession session : sessionStore.all()) {
            if (!session.getStartTime().isBefore(cutoff)) {
                continue;
            }
            if (session.hasInFlightCalls() || !session.lock().tryLock()) {
                skipped++;
                continue;
            }
            try {
                if (session.hasInFlightCalls()) {
                    skipped++;
                    continue;
                }
                session.expire();
                if (sessionStore.remove(session)) {
                    evicted++;
                }
            } finally {
                session.lock().unlock();
            }
        }
        if (evicted > 0 || skipped > 0) {
            log.info("Session cleanup evicted {} sessions, skipped {} busy sessions", evicted, skipped);
        }
        return evicted;
    }

    private PieceGenerationResult nextPieceLocked(VrfSession session) {
        SessionState state = session.getState();
        if (state == SessionState.EXPIRED) {
            throw FairnessException.sessionNotFound(session.getSessionId());
        }
        if (!state.canGenerate()) {
            throw FairnessException.sessionEnded(session.getSessionId());
        }
        long index = session.getPieceIndex();
        if (session.recordedPieceCount() != index) {
            throw FairnessException.pieceIndexOutOfOrder(session.getSessionId(), session.recordedPieceCount(), index);
        }
        byte[] master = session.masterSeed();
        try {
            PieceGenerationResult piece = PieceDerivation.derive(master, session.getSessionId(), index);
            session.recordPiece(piece);
            log.debug("Session {} piece {} -> {}", session.getSessionId(), index, piece.pieceType());
            return piece;
        } finally {
            Arrays.fill(master, (byte) 0);
        }
    }

    private VrfSession requireSession(String sessionId) {
        return sessionStore.find(sessionId)
                .orElseThrow(() -> FairnessException.sessionNotFound(sessionId));
    }

    private String newSessionId() {
        byte[] suffix = new byte[4];
        secureRandom.nextBytes(suffix);
        return "session_" + clock.millis() + "_" + FairnessCrypto.toHex(suffix);
    }
}
