package com.mwor.model;

/**
 * Public view of a generated piece handed to the client during play.
 */
public record GeneratedPiece(
        TetrominoType pieceType,
        String sessionId,
        long pieceIndex,
        String proof
) {
}
