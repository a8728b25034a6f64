package com.mwor.model;

public record RaffleWinner(
        int position,
        String wallet,
        long ticketNumber,
        int rank,
        long score,
        int tickets
) {
}
