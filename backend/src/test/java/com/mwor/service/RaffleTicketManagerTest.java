package com.mwor.service;

import com.mwor.config.RaffleProperties;
import com.mwor.error.FairnessErrorCode;
import com.mwor.error.FairnessException;
import com.mwor.model.PlayRecord;
import com.mwor.model.QualifiedWallet;
import com.mwor.model.RaffleTicket;
import com.mwor.model.ScoreProof;
import com.mwor.model.TicketDistribution;
import com.mwor.model.TicketTier;
import com.mwor.support.FairnessFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RaffleTicketManagerTest {

    private static final String SEED_HASH = "cd".repeat(32);

    private final FairnessFixtures fixtures = new FairnessFixtures();
    private final RaffleTicketManager manager = fixtures.raffleTicketManager;

    @AfterEach
    void tearDown() {
        fixtures.close();
    }

    @Test
    void twelveWalletsQualifyTopQuarterWithFiftyFiveTickets() {
        List<PlayRecord> plays = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            plays.add(signedPlay("wallet-" + i, 1_000L * i));
        }

        List<QualifiedWallet> qualified = manager.getDailyQualifiedWallets(plays);

        assertEquals(3, qualified.size());
        assertEquals(new QualifiedWallet("wallet-12", 12_000, 1, 25, TicketTier.RANK1), qualified.get(0));
        assertEquals(new QualifiedWallet("wallet-11", 11_000, 2, 15, TicketTier.RANKS_2_TO_5), qualified.get(1));
        assertEquals(new QualifiedWallet("wallet-10", 10_000, 3, 15, TicketTier.RANKS_2_TO_5), qualified.get(2));
        assertEquals(55, manager.calculateTicketBudget(qualified));
    }

    @Test
    void onlyEachWalletsBestPlayCounts() {
        List<PlayRecord> plays = List.of(
                signedPlay("alice", 100),
                signedPlay("alice", 900),
                signedPlay("bob", 500),
                signedPlay("carol", 50)
        );
        fixtures.raffleProperties.setLeaderboardSlicePercent(100);

        List<QualifiedWallet> qualified = manager.getDailyQualifiedWallets(plays);

        assertEquals(List.of("alice", "bob", "carol"), qualified.stream().map(QualifiedWallet::wallet).toList());
        assertEquals(900, qualified.get(0).score());
        assertEquals(List.of(1, 2, 3), qualified.stream().map(QualifiedWallet::rank).toList());
    }

    @Test
    void tiesGoToTheEarlierPlayThenToTheWalletAddress() {
        fixtures.raffleProperties.setLeaderboardSlicePercent(100);
        PlayRecord late = signedPlay("aaa-late", 700);
        fixtures.clock.advance(Duration.ofSeconds(-10));
        PlayRecord earlyB = signedPlay("bbb-early", 700);
        PlayRecord earlyA = signedPlay("abc-early", 700);

        List<QualifiedWallet> qualified = manager.getDailyQualifiedWallets(List.of(late, earlyB, earlyA));

        assertEquals(List.of("abc-early", "bbb-early", "aaa-late"),
                qualified.stream().map(QualifiedWallet::wallet).toList());
    }

    @Test
    void ticketTiersFollowRankAndRespectThePerWalletCap() {
        fixtures.raffleProperties.setLeaderboardSlicePercent(100);
        fixtures.raffleProperties.setMaxTicketsPerWallet(12);
        List<PlayRecord> plays = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            plays.add(signedPlay("wallet-" + i, 1_000L * i));
        }

        List<QualifiedWallet> qualified = manager.getDailyQualifiedWallets(plays);

        assertEquals(12, qualified.get(0).tickets());
        assertEquals(12, qualified.get(4).tickets());
        assertEquals(TicketTier.RANKS_6_TO_10, qualified.get(5).tier());
        assertEquals(10, qualified.get(9).tickets());
        assertEquals(TicketTier.REMAINING, qualified.get(10).tier());
        assertEquals(1, qualified.get(11).tickets());

        TicketDistribution distribution = manager.summarizeDistribution(qualified);
        assertEquals(12, distribution.rank1Tickets());
        assertEquals(48, distribution.ranks2to5Tickets());
        assertEquals(50, distribution.ranks6to10Tickets());
        assertEquals(2, distribution.remainingTickets());
        assertEquals(112, distribution.totalTickets());
        assertEquals(manager.calculateTicketBudget(qualified), distribution.totalTickets());
    }

    @Test
    void generateRaffleTickets_numbersTicketsDenselyFromOne() {
        List<PlayRecord> plays = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            plays.add(signedPlay("wallet-" + i, 1_000L * i));
        }
        List<QualifiedWallet> qualified = manager.getDailyQualifiedWallets(plays);

        List<RaffleTicket> tickets = manager.generateRaffleTickets(qualified);

        assertEquals(55, tickets.size());
        for (int i = 0; i < tickets.size(); i++) {
            assertEquals(i + 1, tickets.get(i).ticketNumber());
        }
        assertEquals("wallet-12", tickets.get(24).walletAddress());
        assertEquals("wallet-11", tickets.get(25).walletAddress());
        assertEquals(TicketTier.RANKS_2_TO_5, tickets.get(54).tier());
    }

    @Test
    void invalidSignaturesAreSkippedByDefault() {
        fixtures.raffleProperties.setLeaderboardSlicePercent(100);
        PlayRecord good = signedPlay("honest", 100);
        PlayRecord inflated = inflate(signedPlay("cheater", 100), 1_000_000);
        PlayRecord unsigned = new PlayRecord("unsigned", 5_000, SEED_HASH, "", fixtures.clock.instant(), null);

        List<QualifiedWallet> qualified = manager.getDailyQualifiedWallets(List.of(good, inflated, unsigned));

        assertEquals(List.of("honest"), qualified.stream().map(QualifiedWallet::wallet).toList());
    }

    @Test
    void invalidSignaturesFailTheRunUnderRejectPolicy() {
        fixtures.raffleProperties.setInvalidSignaturePolicy(RaffleProperties.InvalidSignaturePolicy.REJECT);
        PlayRecord inflated = inflate(signedPlay("cheater", 100), 1_000_000);

        FairnessException ex = assertThrows(FairnessException.class,
                () -> manager.getDailyQualifiedWallets(List.of(inflated)));
        assertEquals(FairnessErrorCode.SIGNATURE_INVALID, ex.getErrorCode());
    }

    @Test
    void noPlaysMeansNoQualifiers() {
        assertTrue(manager.getDailyQualifiedWallets(List.of()).isEmpty());
        assertEquals(0, manager.calculateTicketBudget(List.of()));
    }

    private PlayRecord signedPlay(String wallet, long score) {
        ScoreProof proof = fixtures.scoreSigningManager.signScore(wallet, score, SEED_HASH, 10);
        return new PlayRecord(wallet, score, SEED_HASH, "", Instant.ofEpochMilli(proof.timestamp()), proof);
    }

    private static PlayRecord inflate(PlayRecord play, long score) {
        ScoreProof original = play.scoreProof();
        ScoreProof tampered = new ScoreProof(original.walletAddress(), score, original.seedHash(),
                original.moveCount(), original.signature(), original.timestamp());
        return new PlayRecord(play.walletAddress(), score, play.seedHash(), play.moveHash(), play.timestamp(), tampered);
    }
}
