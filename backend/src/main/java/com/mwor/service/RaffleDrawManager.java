package com.mwor.service;

import com.mwor.error.FairnessException;
import com.mwor.model.QualifiedWallet;
import com.mwor.model.RaffleDrawResult;
import com.mwor.model.RaffleWinner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Draws distinct raffle winners from VRF output. Each wallet owns a contiguous range of ticket
 * numbers in rank order; a draw picks a uniform ticket among those still in play and removes the
 * winning wallet's whole range before the next draw.
 */
@Service
public class RaffleDrawManager {

    private static final Logger log = LoggerFactory.getLogger(RaffleDrawManager.class);

    static final String DRAW_INFO = "mwor/raffle-draw/v1";
    private static final int MAX_SAMPLING_ATTEMPTS = 1024;

    private final Clock clock;

    public RaffleDrawManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws FairnessException EMPTY_QUALIFICATION_SET when nobody qualified
     */
    public RaffleDrawResult draw(
            List<QualifiedWallet> qualified,
            int numberOfWinners,
            byte[] vrfOutput,
            String vrfSignature,
            String merkleRoot,
            boolean verifiable) {
        if (qualified == null || qualified.isEmpty()) {
            throw FairnessException.emptyQualificationSet("No qualified wallets to draw from");
        }
        if (numberOfWinners < 1) {
            throw new IllegalArgumentException("numberOfWinners must be positive");
        }
        if (vrfOutput == null || vrfOutput.length == 0) {
            throw new IllegalArgumentException("VRF output is required");
        }

        List<RaffleWinner> winners = selectWinners(qualified, numberOfWinners, vrfOutput);
        long totalTickets = qualified.stream().mapToLong(QualifiedWallet::tickets).sum();
        RaffleDrawResult result = new RaffleDrawResult(
                List.copyOf(winners),
                FairnessCrypto.toHex(vrfOutput),
                vrfSignature,
                totalTickets,
                merkleRoot,
                clock.instant(),
                verifiable
        );
        log.info("Raffle draw selected {} winners from {} wallets holding {} tickets (verifiable={})",
                winners.size(), qualified.size(), totalTickets, verifiable);
        return result;
    }

    /**
     * Replays the draw from the same inputs and compares winners. Never throws.
     */
    public boolean verifyDraw(RaffleDrawResult result, List<QualifiedWallet> qualified, byte[] vrfOutput) {
        if (result == null || qualified == null || qualified.isEmpty() || vrfOutput == null || vrfOutput.length == 0) {
            return false;
        }
        try {
            if (!FairnessCrypto.toHex(vrfOutput).equalsIgnoreCase(result.vrfSeed())) {
                return false;
            }
            long totalTickets = qualified.stream().mapToLong(QualifiedWallet::tickets).sum();
            if (totalTickets != result.totalTickets() || result.winners().isEmpty()) {
                return false;
            }
            List<RaffleWinner> expected = selectWinners(qualified, result.winners().size(), vrfOutput);
            return expected.equals(result.winners());
        } catch (RuntimeException ex) {
            return false;
        }
    }

    private List<RaffleWinner> selectWinners(List<QualifiedWallet> qualified, int numberOfWinners, byte[] vrfOutput) {
        List<QualifiedWallet> ordered = new ArrayList<>(qualified);
        ordered.sort(Comparator.comparingInt(QualifiedWallet::rank));

        List<TicketRange> pool = new ArrayList<>(ordered.size());
        long nextTicket = 1;
        for (QualifiedWallet wallet : ordered) {
            if (wallet.tickets() > 0) {
                pool.add(new TicketRange(wallet, nextTicket));
            }
            nextTicket += wallet.tickets();
        }

        int draws = Math.min(numberOfWinners, pool.size());
        List<RaffleWinner> winners = new ArrayList<>(draws);
        for (int position = 1; position <= draws; position++) {
            long[] cumulative = cumulativeEnds(pool);
            long remaining = cumulative[cumulative.length - 1];
            long ticketOffset = uniformBelow(vrfOutput, position, remaining);
            int slot = findSlot(cumulative, ticketOffset);

            TicketRange range = pool.remove(slot);
            long offsetInRange = ticketOffset - (slot == 0 ? 0 : cumulative[slot - 1]);
            QualifiedWallet wallet = range.wallet();
            winners.add(new RaffleWinner(
                    position,
                    wallet.wallet(),
                    range.firstTicket() + offsetInRange,
                    wallet.rank(),
                    wallet.score(),
                    wallet.tickets()
            ));
        }
        return winners;
    }

    private static long[] cumulativeEnds(List<TicketRange> pool) {
        long[] ends = new long[pool.size()];
        long running = 0;
        for (int i = 0; i < pool.size(); i++) {
            running += pool.get(i).wallet().tickets();
            ends[i] = running;
        }
        return ends;
    }

    /**
     * Index of the first range whose cumulative end exceeds {@code ticketOffset}.
     */
    private static int findSlot(long[] cumulative, long ticketOffset) {
        int found = Arrays.binarySearch(cumulative, ticketOffset + 1);
        if (found >= 0) {
            return found;
        }
        return -found - 1;
    }

    /**
     * Uniform value in {@code [0, bound)} from 63-bit HMAC blocks, rejecting the biased tail.
     */
    static long uniformBelow(byte[] vrfOutput, int position, long bound) {
        long acceptUpTo = Long.MAX_VALUE - ((Long.MAX_VALUE % bound) + 1) % bound;
        for (int attempt = 0; attempt < MAX_SAMPLING_ATTEMPTS; attempt++) {
            byte[] block = FairnessCrypto.hmacSha256(vrfOutput, DRAW_INFO + "|" + position + "|" + attempt);
            long candidate = ByteBuffer.wrap(block).getLong() & Long.MAX_VALUE;
            if (candidate <= acceptUpTo) {
                return candidate % bound;
            }
        }
        throw new IllegalStateException("Rejection sampling did not converge for draw position " + position);
    }

    private record TicketRange(QualifiedWallet wallet, long firstTicket) {
    }
}
