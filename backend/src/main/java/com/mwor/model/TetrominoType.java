package com.mwor.model;

/**
 * The seven falling-block kinds, in the order their ordinal is derived from a piece seed.
 */
public enum TetrominoType {
    I, J, L, O, S, T, Z;

    private static final TetrominoType[] VALUES = values();

    public static TetrominoType fromOrdinal(int ordinal) {
        if (ordinal < 0 || ordinal >= VALUES.length) {
            throw new IllegalArgumentException("Piece ordinal out of range: " + ordinal);
        }
        return VALUES[ordinal];
    }

    public static int count() {
        return VALUES.length;
    }
}
