package com.mwor.model;

/**
 * Public half of a commit-reveal pair, safe to hand to the client before play.
 */
public record SeedCommitment(String seedHash, String sessionId) {
}
