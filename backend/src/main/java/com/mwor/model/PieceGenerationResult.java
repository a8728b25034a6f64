package com.mwor.model;

/**
 * Full piece record. {@code seedUsed} stays server-side until the session has been exported.
 */
public record PieceGenerationResult(
        String sessionId,
        long pieceIndex,
        TetrominoType pieceType,
        String proof,
        String seedUsed
) {

    public GeneratedPiece toPublicView() {
        return new GeneratedPiece(pieceType, sessionId, pieceIndex, proof);
    }
}
