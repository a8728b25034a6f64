package com.mwor.model;

/**
 * One client input event. {@code direction} and {@code rotation} are null when not applicable.
 */
public record GameMove(
        MoveType type,
        long timestamp,
        String direction,
        String rotation
) {

    public static GameMove of(MoveType type, long timestamp) {
        return new GameMove(type, timestamp, null, null);
    }
}
