package com.mwor.model;

import java.time.Instant;

/**
 * A persisted, signed play. Records without a {@code scoreProof} do not qualify for the raffle.
 */
public record PlayRecord(
        String walletAddress,
        long score,
        String seedHash,
        String moveHash,
        Instant timestamp,
        ScoreProof scoreProof
) {
}
