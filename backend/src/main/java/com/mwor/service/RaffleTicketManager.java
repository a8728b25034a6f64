package com.mwor.service;

import com.mwor.config.RaffleProperties;
import com.mwor.error.FairnessException;
import com.mwor.model.PlayRecord;
import com.mwor.model.QualifiedWallet;
import com.mwor.model.RaffleTicket;
import com.mwor.model.ScoreProof;
import com.mwor.model.TicketDistribution;
import com.mwor.model.TicketTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a day's plays into ranked, ticketed raffle entries.
 * Only each wallet's best signed play counts.
 */
@Service
public class RaffleTicketManager {

    private static final Logger log = LoggerFactory.getLogger(RaffleTicketManager.class);

    private static final Comparator<PlayRecord> LEADERBOARD_ORDER = Comparator
            .comparingLong(PlayRecord::score).reversed()
            .thenComparing(PlayRecord::timestamp)
            .thenComparing(PlayRecord::walletAddress);

    private final RaffleProperties raffleProperties;
    private final ScoreSigningManager scoreSigningManager;

    public RaffleTicketManager(RaffleProperties raffleProperties, ScoreSigningManager scoreSigningManager) {
        this.raffleProperties = raffleProperties;
        this.scoreSigningManager = scoreSigningManager;
    }

    /**
     * Ranks the top slice of unique wallets by best score. Ties go to the earlier play, then to
     * the lexicographically smaller wallet.
     *
     * @throws FairnessException SIGNATURE_INVALID when a play fails signature checks and the
     *                           policy is {@code REJECT}
     */
    public List<QualifiedWallet> getDailyQualifiedWallets(List<PlayRecord> plays) {
        Map<String, PlayRecord> bestByWallet = new HashMap<>();
        int skipped = 0;
        for (PlayRecord play : plays) {
            if (!hasValidProof(play)) {
                if (raffleProperties.getInvalidSignaturePolicy() == RaffleProperties.InvalidSignaturePolicy.REJECT) {
                    throw FairnessException.signatureInvalid(play.walletAddress());
                }
                skipped++;
                continue;
            }
            bestByWallet.merge(play.walletAddress(), play,
                    (current, candidate) -> LEADERBOARD_ORDER.compare(candidate, current) < 0 ? candidate : current);
        }
        if (skipped > 0) {
            log.warn("Skipped {} plays with missing or invalid score signatures", skipped);
        }

        List<PlayRecord> leaderboard = new ArrayList<>(bestByWallet.values());
        leaderboard.sort(LEADERBOARD_ORDER);

        int qualifiedCount = (int) Math.ceil(leaderboard.size() * raffleProperties.getLeaderboardSlicePercent() / 100.0);
        qualifiedCount = Math.min(qualifiedCount, leaderboard.size());

        List<QualifiedWallet> qualified = new ArrayList<>(qualifiedCount);
        for (int i = 0; i < qualifiedCount; i++) {
            PlayRecord play = leaderboard.get(i);
            int rank = i + 1;
            TicketTier tier = TicketTier.forRank(rank);
            qualified.add(new QualifiedWallet(play.walletAddress(), play.score(), rank, ticketsFor(tier), tier));
        }
        log.info("{} of {} unique wallets qualified for the raffle", qualified.size(), leaderboard.size());
        return List.copyOf(qualified);
    }

    /**
     * One ticket per allocation, numbered from 1 across all wallets in rank order.
     */
    public List<RaffleTicket> generateRaffleTickets(List<QualifiedWallet> qualified) {
        List<RaffleTicket> tickets = new ArrayList<>();
        long ticketNumber = 1;
        for (QualifiedWallet wallet : qualified) {
            for (int i = 0; i < wallet.tickets(); i++) {
                tickets.add(new RaffleTicket(wallet.wallet(), ticketNumber++, wallet.tier(), wallet.score(), wallet.rank()));
            }
        }
        return tickets;
    }

    public long calculateTicketBudget(List<QualifiedWallet> qualified) {
        return qualified.stream().mapToLong(QualifiedWallet::tickets).sum();
    }

    public TicketDistribution summarizeDistribution(List<QualifiedWallet> qualified) {
        long[] perTier = new long[TicketTier.values().length];
        for (QualifiedWallet wallet : qualified) {
            perTier[wallet.tier().ordinal()] += wallet.tickets();
        }
        return new TicketDistribution(
                perTier[TicketTier.RANK1.ordinal()],
                perTier[TicketTier.RANKS_2_TO_5.ordinal()],
                perTier[TicketTier.RANKS_6_TO_10.ordinal()],
                perTier[TicketTier.REMAINING.ordinal()],
                calculateTicketBudget(qualified)
        );
    }

    private int ticketsFor(TicketTier tier) {
        RaffleProperties.TicketTiers tiers = raffleProperties.getTicketTiers();
        int base = switch (tier) {
            case RANK1 -> tiers.getRank1();
            case RANKS_2_TO_5 -> tiers.getRanks2to5();
            case RANKS_6_TO_10 -> tiers.getRanks6to10();
            case REMAINING -> tiers.getRemaining();
        };
        return Math.max(0, Math.min(base, raffleProperties.getMaxTicketsPerWallet()));
    }

    private boolean hasValidProof(PlayRecord play) {
        ScoreProof proof = play.scoreProof();
        return proof != null
                && play.walletAddress().equals(proof.walletAddress())
                && play.score() == proof.score()
                && scoreSigningManager.verifyScoreSignature(proof);
    }
}
