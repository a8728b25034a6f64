package com.mwor.model;

import java.time.Instant;

/**
 * Public snapshot of a VRF session. Carries no secret material.
 */
public record SessionSnapshot(
        String sessionId,
        String walletAddress,
        String masterSeedHash,
        long pieceIndex,
        Instant startTime,
        String vrfSignature,
        boolean verifiable,
        SessionState state
) {
}
