package com.mwor.service;

import com.mwor.error.FairnessException;
import com.mwor.model.BotAssessment;
import com.mwor.model.GameCompletionResult;
import com.mwor.model.GameMove;
import com.mwor.model.PlayRecord;
import com.mwor.model.ScoreProof;
import com.mwor.model.SessionSnapshot;
import com.mwor.repository.PlayRecordSource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Closes a game: ends the session, reveals its seed, signs the externally computed score and
 * records the play for the daily raffle.
 */
@Service
@RequiredArgsConstructor
public class GameCompletionService {

    private static final Logger log = LoggerFactory.getLogger(GameCompletionService.class);

    private final PieceGenerationEngine pieceGenerationEngine;
    private final CommitRevealManager commitRevealManager;
    private final ScoreSigningManager scoreSigningManager;
    private final AbuseDetector abuseDetector;
    private final PlayAuditService playAuditService;
    private final PlayRecordSource playRecordSource;

    /**
     * @throws FairnessException SESSION_NOT_FOUND when the session is unknown or expired,
     *                           SESSION_ENDED when the session was already completed
     */
    public GameCompletionResult completeGame(String sessionId, long score, List<GameMove> moves) {
        List<GameMove> safeMoves = moves == null ? List.of() : List.copyOf(moves);
        SessionSnapshot snapshot = pieceGenerationEngine.exportSessionData(sessionId);
        if (snapshot == null) {
            throw FairnessException.sessionNotFound(sessionId);
        }
        commitRevealManager.markSessionCompleted(sessionId);

        String revealedSeed = commitRevealManager.revealSeed(sessionId);
        String seedHash = commitRevealManager.requireCommitment(sessionId).getSeedHash();
        ScoreProof scoreProof = scoreSigningManager.signScore(
                snapshot.walletAddress(), score, seedHash, safeMoves.size());

        BotAssessment assessment = abuseDetector.detectBot(safeMoves);
        if (assessment.isBot()) {
            log.warn("Session {} flagged as bot-like: confidence={}, signals={}",
                    sessionId, assessment.confidence(), assessment.signals());
        }

        PlayRecord playRecord = new PlayRecord(
                snapshot.walletAddress(),
                score,
                seedHash,
                playAuditService.hashMoveSequence(safeMoves),
                Instant.ofEpochMilli(scoreProof.timestamp()),
                scoreProof
        );
        playRecordSource.record(playRecord);
        log.info("Completed session {} for wallet {} with score {} over {} moves",
                sessionId, CommitRevealManager.abbreviate(snapshot.walletAddress()), score, safeMoves.size());
        return new GameCompletionResult(snapshot, revealedSeed, scoreProof, assessment, playRecord);
    }
}
