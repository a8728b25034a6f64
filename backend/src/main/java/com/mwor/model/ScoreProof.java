package com.mwor.model;

/**
 * Ed25519 attestation over a finished session's score.
 * The signature covers {@code walletAddress:score:seedHash:moveCount:timestamp}.
 */
public record ScoreProof(
        String walletAddress,
        long score,
        String seedHash,
        int moveCount,
        String signature,
        long timestamp
) {
}
