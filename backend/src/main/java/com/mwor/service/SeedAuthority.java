package com.mwor.service;

import com.mwor.config.MworRuntimeProperties;
import com.mwor.error.FairnessException;
import com.mwor.model.DailySeed;
import com.mwor.model.RoundSeed;
import com.mwor.model.VrfRandomness;
import com.mwor.oracle.VrfOracleClient;
import com.mwor.oracle.VrfOracleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the day's VRF beacon and derives per-round seeds from it.
 * Rotation happens once per UTC day, either lazily on the first read after midnight or from
 * the maintenance scheduler. Readers only ever see a complete seed through a single reference swap.
 */
@Service
public class SeedAuthority {

    private static final Logger log = LoggerFactory.getLogger(SeedAuthority.class);

    static final String DAILY_SEED_PURPOSE = "daily-seed";
    static final String RAFFLE_DRAW_PURPOSE = "raffle-draw";

    private final VrfOracleClient oracleClient;
    private final MworRuntimeProperties runtimeProperties;
    private final ExecutorService oracleExecutor;
    private final Clock clock;

    private final AtomicReference<DailySeed> activeSeed = new AtomicReference<>();
    private final ConcurrentNavigableMap<LocalDate, DailySeed> retiredSeeds = new ConcurrentSkipListMap<>();
    private final Object rotationMonitor = new Object();
    private final SecureRandom secureRandom = new SecureRandom();

    public SeedAuthority(
            VrfOracleClient oracleClient,
            MworRuntimeProperties runtimeProperties,
            @Qualifier("oracleExecutor") ExecutorService oracleExecutor,
            Clock clock) {
        this.oracleClient = oracleClient;
        this.runtimeProperties = runtimeProperties;
        this.oracleExecutor = oracleExecutor;
        this.clock = clock;
    }

    /**
     * Returns the active seed, rotating first when the current one has passed its rotation instant.
     *
     * @throws FairnessException ORACLE_UNAVAILABLE when rotation is required, the oracle fails and the
     *                           fallback policy is fail-closed
     */
    public DailySeed getCurrentSeed() {
        DailySeed seed = activeSeed.get();
        Instant now = clock.instant();
        if (seed == null || !now.isBefore(seed.rotatesAt())) {
            return rotateIfDue();
        }
        return seed;
    }

    /**
     * Derives {@code HMAC-SHA256(currentSeed, wallet:sessionId)}.
     */
    public RoundSeed deriveRoundSeed(String walletAddress, String sessionId) {
        if (!StringUtils.hasText(walletAddress)) {
            throw new IllegalArgumentException("Wallet is required");
        }
        if (!StringUtils.hasText(sessionId)) {
            throw new IllegalArgumentException("sessionId is required");
        }
        DailySeed seed = getCurrentSeed();
        byte[] roundSeed = FairnessCrypto.hmacSha256(seed.seed(), walletAddress + ":" + sessionId);
        return new RoundSeed(roundSeed, seed.day(), seed.vrfSignature(), seed.verifiable());
    }

    /**
     * Rotates only if no seed is active or the active one has expired. Used by the scheduler and lazy reads.
     */
    public DailySeed rotateIfDue() {
        synchronized (rotationMonitor) {
            DailySeed seed = activeSeed.get();
            if (seed != null && clock.instant().isBefore(seed.rotatesAt())) {
                return seed;
            }
            return rotateSeed();
        }
    }

    /**
     * Fetches a fresh beacon for the current UTC day and swaps it in. The previous seed is retired
     * into the bounded history.
     */
    public DailySeed rotateSeed() {
        synchronized (rotationMonitor) {
            Instant now = clock.instant();
            LocalDate day = LocalDate.ofInstant(now, ZoneOffset.UTC);
            log.info("Rotating VRF seed for {} using oracle {}", day, oracleClient.describe());

            OracleMaterial material = fetchOracleMaterial(DAILY_SEED_PURPOSE, day);
            DailySeed next = new DailySeed(
                    day,
                    material.randomness(),
                    material.proof(),
                    material.signature(),
                    now,
                    day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant(),
                    material.verifiable(),
                    true
            );

            DailySeed previous = activeSeed.getAndSet(next);
            if (previous != null) {
                retiredSeeds.put(previous.day(), previous.retire());
                pruneRetiredSeeds(day);
            }

            log.info("VRF seed rotated: day={}, seedHash={}..., verifiable={}, rotatesAt={}",
                    day,
                    FairnessCrypto.sha256Hex(next.seed()).substring(0, 16),
                    next.verifiable(),
                    next.rotatesAt());
            return next;
        }
    }

    /**
     * Fresh oracle randomness for the raffle draw of the given day.
     */
    public VrfRandomness requestDrawRandomness(LocalDate day) {
        OracleMaterial material = fetchOracleMaterial(RAFFLE_DRAW_PURPOSE, day);
        return new VrfRandomness(material.randomness(), material.signature(), material.verifiable());
    }

    public Optional<DailySeed> findSeedForDay(LocalDate day) {
        DailySeed active = activeSeed.get();
        if (active != null && active.day().equals(day)) {
            return Optional.of(active);
        }
        return Optional.ofNullable(retiredSeeds.get(day));
    }

    public Optional<DailySeed> peekActiveSeed() {
        return Optional.ofNullable(activeSeed.get());
    }

    public String oracleDescription() {
        return oracleClient.describe();
    }

    private void pruneRetiredSeeds(LocalDate today) {
        LocalDate cutoff = today.minusDays(Math.max(0, runtimeProperties.getSeed().getRetainedDays()));
        retiredSeeds.headMap(cutoff, false).clear();
    }

    private OracleMaterial fetchOracleMaterial(String purpose, LocalDate day) {
        MworRuntimeProperties.Seed seedProperties = runtimeProperties.getSeed();
        int maxAttempts = Math.max(1, seedProperties.getOracleMaxAttempts());
        long backoffMs = Math.max(0L, seedProperties.getOracleInitialBackoffMs());
        RuntimeException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Future<VrfOracleResult> pending = oracleExecutor.submit(() -> oracleClient.requestRandomness(purpose, day));
            try {
                VrfOracleResult result = pending.get(seedProperties.getOracleTimeoutMs(), TimeUnit.MILLISECONDS);
                validate(result);
                return new OracleMaterial(result.randomness(), result.proof(), result.signature(), true);
            } catch (TimeoutException ex) {
                pending.cancel(true);
                lastFailure = new IllegalStateException(
                        "Oracle did not answer within " + seedProperties.getOracleTimeoutMs() + "ms", ex);
                log.warn("VRF oracle attempt {}/{} for {} {} timed out", attempt, maxAttempts, purpose, day);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                lastFailure = new IllegalStateException(cause.getMessage(), cause);
                log.warn("VRF oracle attempt {}/{} for {} {} failed: {}",
                        attempt, maxAttempts, purpose, day, cause.getMessage());
            } catch (IllegalStateException ex) {
                lastFailure = ex;
                log.warn("VRF oracle attempt {}/{} for {} {} returned an invalid result: {}",
                        attempt, maxAttempts, purpose, day, ex.getMessage());
            } catch (InterruptedException ex) {
                pending.cancel(true);
                Thread.currentThread().interrupt();
                throw FairnessException.oracleUnavailable("interrupted while waiting for " + purpose, ex);
            }

            if (attempt < maxAttempts && backoffMs > 0) {
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw FairnessException.oracleUnavailable("interrupted during retry backoff", ex);
                }
                backoffMs = backoffMs * 2;
            }
        }

        return applyFallbackPolicy(purpose, day, maxAttempts, lastFailure);
    }

    private OracleMaterial applyFallbackPolicy(String purpose, LocalDate day, int attempts, RuntimeException lastFailure) {
        if (runtimeProperties.getSeed().getFallbackPolicy() == MworRuntimeProperties.FallbackPolicy.LOCAL_CSPRNG) {
            log.error("VRF oracle failed {} times for {} {}; using local CSPRNG seed flagged as unverifiable",
                    attempts, purpose, day);
            byte[] randomness = new byte[FairnessCrypto.SEED_BYTES];
            secureRandom.nextBytes(randomness);
            return new OracleMaterial(randomness, new byte[0], "unverifiable-local-" + purpose + "-" + day, false);
        }
        log.error("VRF oracle failed {} times for {} {}; refusing to issue randomness", attempts, purpose, day);
        throw FairnessException.oracleUnavailable(
                purpose + " for " + day + " after " + attempts + " attempts", lastFailure);
    }

    private static void validate(VrfOracleResult result) {
        if (result == null) {
            throw new IllegalStateException("Oracle returned no result");
        }
        byte[] randomness = result.randomness();
        if (randomness == null || randomness.length != FairnessCrypto.SEED_BYTES) {
            throw new IllegalStateException("Oracle randomness must be " + FairnessCrypto.SEED_BYTES + " bytes");
        }
        boolean allZero = true;
        for (byte b : randomness) {
            if (b != 0) {
                allZero = false;
                break;
            }
        }
        if (allZero) {
            throw new IllegalStateException("Oracle randomness is all zero");
        }
        if (!StringUtils.hasText(result.signature())) {
            throw new IllegalStateException("Oracle signature is missing");
        }
    }

    private record OracleMaterial(byte[] randomness, byte[] proof, String signature, boolean verifiable) {
    }
}
