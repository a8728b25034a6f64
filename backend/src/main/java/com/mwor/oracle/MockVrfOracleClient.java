package com.mwor.oracle;

import com.mwor.service.FairnessCrypto;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

/**
 * Deterministic oracle used for local runs and tests: the same purpose and day always
 * produce the same randomness.
 */
@Component
@ConditionalOnProperty(
        prefix = "mwor.oracle",
        name = "mode",
        havingValue = "mock",
        matchIfMissing = true
)
public class MockVrfOracleClient implements VrfOracleClient {

    @Override
    public VrfOracleResult requestRandomness(String purpose, LocalDate day) {
        String label = purpose + "-" + day;
        byte[] randomness = FairnessCrypto.sha256(("mock-vrf-" + label).getBytes(StandardCharsets.UTF_8));
        byte[] proof = FairnessCrypto.sha256(("mock-proof-" + label).getBytes(StandardCharsets.UTF_8));
        return new VrfOracleResult(randomness, proof, "mock-vrf-" + label);
    }

    @Override
    public String describe() {
        return "mock";
    }
}
