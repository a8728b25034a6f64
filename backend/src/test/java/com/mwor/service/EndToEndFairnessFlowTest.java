package com.mwor.service;

import com.mwor.error.FairnessErrorCode;
import com.mwor.error.FairnessException;
import com.mwor.model.DailyRaffleResult;
import com.mwor.model.GameCompletionResult;
import com.mwor.model.GameMove;
import com.mwor.model.MoveType;
import com.mwor.model.PieceGenerationResult;
import com.mwor.model.QualifiedWallet;
import com.mwor.model.RaffleQualification;
import com.mwor.model.SessionSnapshot;
import com.mwor.support.FairnessFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EndToEndFairnessFlowTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 14);

    private final FairnessFixtures fixtures = new FairnessFixtures();

    @AfterEach
    void tearDown() {
        fixtures.close();
    }

    @Test
    void completedGameIsReplayableAndSigned() {
        SessionSnapshot start = fixtures.pieceGenerationEngine.initializeSession("player-one", "game-1");
        fixtures.pieceGenerationEngine.generatePieceSequence("game-1", 30);
        fixtures.clock.advance(Duration.ofMinutes(3));

        GameCompletionResult result = fixtures.gameCompletionService.completeGame("game-1", 4_200, humanMoves(120));

        String seedHash = result.scoreProof().seedHash();
        assertTrue(CommitRevealManager.verifyReveal(seedHash, result.revealedSeed()));
        assertTrue(fixtures.scoreSigningManager.verifyScoreSignature(result.scoreProof()));
        assertEquals(120, result.scoreProof().moveCount());
        assertFalse(result.botAssessment().isBot());

        List<PieceGenerationResult> disclosed = fixtures.pieceGenerationEngine.disclosePieces("game-1");
        assertEquals(disclosed,
                PieceDerivation.replay(result.revealedSeed(), "player-one", start.startTime(), "game-1", 30));

        assertEquals(1, fixtures.playRecordStore.findPlaysBetween(
                DAY.atStartOfDay(ZoneOffset.UTC).toInstant(),
                DAY.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant()).size());
        assertEquals(fixtures.playAuditService.hashMoveSequence(humanMoves(120)), result.playRecord().moveHash());
    }

    @Test
    void aSessionCompletesOnlyOnce() {
        fixtures.pieceGenerationEngine.initializeSession("player-one", "game-1");
        fixtures.pieceGenerationEngine.generatePieceSequence("game-1", 10);
        fixtures.gameCompletionService.completeGame("game-1", 100, humanMoves(40));

        FairnessException ex = assertThrows(FairnessException.class,
                () -> fixtures.gameCompletionService.completeGame("game-1", 99_999, humanMoves(40)));

        assertEquals(FairnessErrorCode.SESSION_ENDED, ex.getErrorCode());
        List<Long> scores = fixtures.playRecordStore.findPlaysBetween(
                        DAY.atStartOfDay(ZoneOffset.UTC).toInstant(),
                        DAY.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant())
                .stream().map(play -> play.score()).toList();
        assertEquals(List.of(100L), scores);
    }

    @Test
    void completingAnUnknownSessionFails() {
        FairnessException ex = assertThrows(FairnessException.class,
                () -> fixtures.gameCompletionService.completeGame("missing", 10, List.of()));
        assertEquals(FairnessErrorCode.SESSION_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    void dailyRaffleQualifiesProvesAndDrawsVerifiably() {
        for (int i = 1; i <= 12; i++) {
            String wallet = "wallet-" + i;
            String sessionId = "game-" + i;
            fixtures.pieceGenerationEngine.initializeSession(wallet, sessionId);
            fixtures.pieceGenerationEngine.generatePieceSequence(sessionId, 5);
            fixtures.gameCompletionService.completeGame(sessionId, 1_000L * i, humanMoves(20));
        }

        DailyRaffleResult raffle = fixtures.dailyRaffleOrchestrator.executeDailyRaffle(DAY);

        assertEquals(3, raffle.qualifications().size());
        assertEquals(55, raffle.ticketDistribution().totalTickets());
        for (RaffleQualification qualification : raffle.qualifications()) {
            QualifiedWallet wallet = qualification.wallet();
            assertTrue(MerkleAuditTree.verifyProof(wallet.wallet(), wallet.rank(), wallet.score(), wallet.tickets(),
                    qualification.merkleProof(), raffle.merkleRoot()));
        }

        List<QualifiedWallet> qualified = raffle.qualifications().stream().map(RaffleQualification::wallet).toList();
        byte[] drawRandomness = fixtures.seedAuthority.requestDrawRandomness(DAY).value();
        assertEquals(3, raffle.drawResult().winners().size());
        assertEquals(raffle.merkleRoot(), raffle.drawResult().merkleRoot());
        assertTrue(raffle.drawResult().verifiable());
        assertTrue(fixtures.raffleDrawManager.verifyDraw(raffle.drawResult(), qualified, drawRandomness));
    }

    @Test
    void dailyRaffleWithoutPlaysIsRejected() {
        FairnessException ex = assertThrows(FairnessException.class,
                () -> fixtures.dailyRaffleOrchestrator.executeDailyRaffle(DAY));
        assertEquals(FairnessErrorCode.EMPTY_QUALIFICATION_SET, ex.getErrorCode());
    }

    private static List<GameMove> humanMoves(int count) {
        Random random = new Random(count);
        MoveType[] types = MoveType.values();
        List<GameMove> moves = new ArrayList<>();
        long timestamp = 0;
        for (int i = 0; i < count; i++) {
            moves.add(GameMove.of(types[i % types.length], timestamp));
            timestamp += 220 + random.nextInt(131);
        }
        return moves;
    }
}
