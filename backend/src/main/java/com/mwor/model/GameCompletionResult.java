package com.mwor.model;

/**
 * Everything a client needs after a game to audit it: the session snapshot, the revealed round
 * seed, the signed score and the stored play.
 */
public record GameCompletionResult(
        SessionSnapshot session,
        String revealedSeed,
        ScoreProof scoreProof,
        BotAssessment botAssessment,
        PlayRecord playRecord
) {
}
