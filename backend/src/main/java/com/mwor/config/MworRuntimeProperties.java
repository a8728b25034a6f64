package com.mwor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Seed authority, oracle and session runtime settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "mwor")
public class MworRuntimeProperties {

    private Seed seed = new Seed();
    private Oracle oracle = new Oracle();
    private Session session = new Session();
    private Abuse abuse = new Abuse();

    public enum FallbackPolicy {
        /**
         * Refuse new seeds while the oracle is unreachable.
         */
        FAIL_CLOSED,
        /**
         * Continue on a locally generated seed flagged as unverifiable.
         */
        LOCAL_CSPRNG
    }

    @Getter
    @Setter
    public static class Seed {
        private FallbackPolicy fallbackPolicy = FallbackPolicy.FAIL_CLOSED;
        private int retainedDays = 7;
        private long oracleTimeoutMs = 8_000;
        private int oracleMaxAttempts = 3;
        private long oracleInitialBackoffMs = 500;
        private boolean scheduledRotationEnabled = true;
        private String rotationCron = "0 0 0 * * *";
    }

    @Getter
    @Setter
    public static class Oracle {
        private String mode = "mock";
        private String rpcUrl = "https://api.devnet.solana.com";
        private String vrfAccount = "";
        private int resultOffset = 8;
    }

    @Getter
    @Setter
    public static class Session {
        private long ttlMinutes = 24 * 60;
        private long cleanupIntervalMs = 300_000;
        private long cleanupInitialDelayMs = 60_000;
    }

    @Getter
    @Setter
    public static class Abuse {
        private double varianceThresholdMs2 = 100.0;
        private long fastMoveThresholdMs = 80;
        private double fastMoveRatio = 0.1;
        private double dropRatio = 0.8;
        private double varianceWeight = 0.5;
        private double fastMoveWeight = 0.3;
        private double dropWeight = 0.2;
        private double botThreshold = 0.5;
    }
}
