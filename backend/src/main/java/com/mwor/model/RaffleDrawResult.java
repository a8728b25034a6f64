package com.mwor.model;

import java.time.Instant;
import java.util.List;

public record RaffleDrawResult(
        List<RaffleWinner> winners,
        String vrfSeed,
        String vrfSignature,
        long totalTickets,
        String merkleRoot,
        Instant drawTimestamp,
        boolean verifiable
) {

    public List<String> winnerWallets() {
        return winners.stream().map(RaffleWinner::wallet).toList();
    }
}
