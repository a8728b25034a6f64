package com.mwor.service;

import com.mwor.config.CommitSecurityProperties;
import com.mwor.error.FairnessException;
import com.mwor.model.Commitment;
import com.mwor.model.RoundSeed;
import com.mwor.model.SeedCommitment;
import com.mwor.repository.CommitmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Commits a round seed before play by publishing its SHA-256 and discloses the seed once the
 * session has ended. A session can be revealed once; later reveals return the stored value.
 */
@Service
public class CommitRevealManager {

    private static final Logger log = LoggerFactory.getLogger(CommitRevealManager.class);

    private final SeedAuthority seedAuthority;
    private final CommitmentRepository commitmentRepository;
    private final SeedEnvelopeCryptoService envelopeCryptoService;
    private final CommitSecurityProperties commitSecurityProperties;
    private final Clock clock;

    private final ConcurrentMap<String, Object> sessionMonitors = new ConcurrentHashMap<>();

    public CommitRevealManager(
            SeedAuthority seedAuthority,
            CommitmentRepository commitmentRepository,
            SeedEnvelopeCryptoService envelopeCryptoService,
            CommitSecurityProperties commitSecurityProperties,
            Clock clock) {
        this.seedAuthority = seedAuthority;
        this.commitmentRepository = commitmentRepository;
        this.envelopeCryptoService = envelopeCryptoService;
        this.commitSecurityProperties = commitSecurityProperties;
        this.clock = clock;
    }

    /**
     * Derives the round seed for {@code (wallet, sessionId)} and stores its commitment.
     * Committing a session that is still in play returns the existing hash.
     *
     * @throws FairnessException SEED_ALREADY_REVEALED when the session was already revealed,
     *                           SESSION_ENDED when the session has ended and its seed is revealable,
     *                           ORACLE_UNAVAILABLE when no daily seed can be obtained
     */
    public SeedCommitment commitSeed(String walletAddress, String sessionId) {
        if (!StringUtils.hasText(walletAddress)) {
            throw new IllegalArgumentException("Wallet is required");
        }
        if (!StringUtils.hasText(sessionId)) {
            throw new IllegalArgumentException("sessionId is required");
        }

        synchronized (monitorFor(sessionId)) {
            Commitment existing = commitmentRepository.findBySessionId(sessionId).orElse(null);
            if (existing != null) {
                return existingCommitment(existing, walletAddress, sessionId);
            }

            RoundSeed roundSeed = seedAuthority.deriveRoundSeed(walletAddress, sessionId);
            byte[] seed = roundSeed.seed();
            try {
                Commitment commitment = new Commitment();
                commitment.setSessionId(sessionId);
                commitment.setWalletAddress(walletAddress);
                commitment.setSeedHash(FairnessCrypto.sha256Hex(seed));
                commitment.setEncryptedSeed(envelopeCryptoService.seal(seed));
                commitment.setSeedDay(roundSeed.day());
                commitment.setVerifiable(roundSeed.verifiable());
                commitment.setVrfSignature(roundSeed.vrfSignature());
                commitment.setCommittedAt(OffsetDateTime.now(clock));

                Commitment stored = commitmentRepository.saveIfAbsent(commitment);
                log.info("Committed seed for session {} (wallet {}, hash {}...)",
                        sessionId, abbreviate(walletAddress), stored.getSeedHash().substring(0, 16));
                return new SeedCommitment(stored.getSeedHash(), sessionId);
            } finally {
                Arrays.fill(seed, (byte) 0);
            }
        }
    }

    /**
     * Reveals the committed seed as lowercase hex.
     *
     * @return the seed, or {@code null} when no commitment exists for the session
     * @throws FairnessException REVEAL_BEFORE_SESSION_END while the session is still running
     */
    public String revealSeed(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return null;
        }
        synchronized (monitorFor(sessionId)) {
            Commitment commitment = commitmentRepository.findBySessionId(sessionId).orElse(null);
            if (commitment == null) {
                return null;
            }
            if (commitment.isRevealed()) {
                return commitment.getRevealedSeed();
            }
            if (!commitment.isSessionEnded()) {
                throw FairnessException.revealBeforeSessionEnd(sessionId);
            }

            byte[] seed = envelopeCryptoService.open(commitment.getEncryptedSeed());
            String seedHex = FairnessCrypto.toHex(seed);
            if (!verifyReveal(commitment.getSeedHash(), seedHex)) {
                throw new IllegalStateException("Stored seed does not match commitment for session " + sessionId);
            }
            commitment.setRevealedSeed(seedHex);
            commitment.setRevealedAt(OffsetDateTime.now(clock));
            commitmentRepository.save(commitment);
            log.info("Revealed seed for session {}", sessionId);
            return seedHex;
        }
    }

    /**
     * Marks the session as ended so that its seed may be revealed.
     *
     * @throws FairnessException SEED_NOT_COMMITTED when the session has no commitment
     */
    public void markSessionEnded(String sessionId) {
        synchronized (monitorFor(sessionId)) {
            Commitment commitment = commitmentRepository.findBySessionId(sessionId)
                    .orElseThrow(() -> FairnessException.seedNotCommitted(sessionId));
            if (commitment.isSessionEnded()) {
                return;
            }
            commitment.setSessionEnded(true);
            commitment.setSessionEndedAt(OffsetDateTime.now(clock));
            commitmentRepository.save(commitment);
        }
    }

    /**
     * Records that the session's score has been settled. A session completes once.
     *
     * @throws FairnessException SEED_NOT_COMMITTED when the session has no commitment,
     *                           SESSION_ENDED when the session was already completed
     */
    public void markSessionCompleted(String sessionId) {
        synchronized (monitorFor(sessionId)) {
            Commitment commitment = commitmentRepository.findBySessionId(sessionId)
                    .orElseThrow(() -> FairnessException.seedNotCommitted(sessionId));
            if (commitment.isCompleted()) {
                throw FairnessException.sessionAlreadyCompleted(sessionId);
            }
            commitment.setCompletedAt(OffsetDateTime.now(clock));
            commitmentRepository.save(commitment);
        }
    }

    /**
     * True when {@code sha256(revealedSeed) == seedHash}. Both values are hex, 0x prefix optional.
     */
    public static boolean verifyReveal(String seedHash, String revealedSeed) {
        try {
            String expected = FairnessCrypto.normalizeHex32(seedHash);
            String actual = FairnessCrypto.sha256Hex(FairnessCrypto.decodeHex32(revealedSeed));
            return FairnessCrypto.constantTimeEquals(expected, actual);
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * Drops commitments older than the configured retention.
     *
     * @return number of commitments removed
     */
    public int cleanupExpiredCommitments() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock)
                .minusHours(Math.max(0, commitSecurityProperties.getRetentionHours()));
        List<Commitment> expired = commitmentRepository.findByCommittedAtBefore(cutoff);
        for (Commitment commitment : expired) {
            synchronized (monitorFor(commitment.getSessionId())) {
                commitmentRepository.deleteBySessionId(commitment.getSessionId());
            }
            sessionMonitors.remove(commitment.getSessionId());
        }
        if (!expired.isEmpty()) {
            log.info("Removed {} commitments older than {}", expired.size(), cutoff);
        }
        return expired.size();
    }

    /**
     * Raw committed seed for the engine. Never exposed outside the service package.
     */
    byte[] committedSeed(String sessionId) {
        Commitment commitment = requireCommitment(sessionId);
        return envelopeCryptoService.open(commitment.getEncryptedSeed());
    }

    Commitment requireCommitment(String sessionId) {
        return commitmentRepository.findBySessionId(sessionId)
                .orElseThrow(() -> FairnessException.seedNotCommitted(sessionId));
    }

    private SeedCommitment existingCommitment(Commitment existing, String walletAddress, String sessionId) {
        if (existing.isRevealed()) {
            throw FairnessException.seedAlreadyRevealed(sessionId);
        }
        // an ended session's seed is revealable, so its id cannot back a new game
        if (existing.isSessionEnded()) {
            throw FairnessException.sessionIdReused(sessionId);
        }
        if (!existing.getWalletAddress().equals(walletAddress)) {
            throw new IllegalArgumentException("Session " + sessionId + " is committed to a different wallet");
        }
        return new SeedCommitment(existing.getSeedHash(), sessionId);
    }

    private Object monitorFor(String sessionId) {
        return sessionMonitors.computeIfAbsent(sessionId, ignored -> new Object());
    }

    static String abbreviate(String walletAddress) {
        if (walletAddress == null || walletAddress.length() <= 10) {
            return walletAddress;
        }
        return walletAddress.substring(0, 4) + "..." + walletAddress.substring(walletAddress.length() - 4);
    }
}
