package com.mwor.service;

import com.mwor.model.PieceGenerationResult;
import com.mwor.model.TetrominoType;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Deterministic derivation of the piece stream from a session's master seed.
 * Anyone holding the revealed round seed can run {@link #replay} to reproduce the session.
 */
public final class PieceDerivation {

    static final String PIECE_TYPE_INFO = "mwor/piece-type/v1";
    static final String PIECE_PROOF_INFO = "mwor/piece-proof/v1";

    private PieceDerivation() {
    }

    public static byte[] masterSeed(byte[] roundSeed, String walletAddress, Instant startTime) {
        return FairnessCrypto.hmacSha256(roundSeed, walletAddress + ":" + startTime.toEpochMilli());
    }

    public static byte[] pieceSeed(byte[] masterSeed, long pieceIndex, String sessionId) {
        return FairnessCrypto.hmacSha256(masterSeed, "piece:" + pieceIndex + ":" + sessionId);
    }

    public static TetrominoType pieceType(byte[] pieceSeed) {
        byte[] typeBytes = FairnessCrypto.hkdf(pieceSeed, PIECE_TYPE_INFO, 4);
        long value = Integer.toUnsignedLong(ByteBuffer.wrap(typeBytes).getInt());
        return TetrominoType.fromOrdinal((int) (value % TetrominoType.count()));
    }

    public static String proof(byte[] pieceSeed, String sessionId, long pieceIndex, TetrominoType pieceType) {
        byte[] proofKey = FairnessCrypto.hkdf(pieceSeed, PIECE_PROOF_INFO, FairnessCrypto.SEED_BYTES);
        return FairnessCrypto.toHex(FairnessCrypto.hmacSha256(
                proofKey, sessionId + "|" + pieceIndex + "|" + pieceType.name()));
    }

    public static PieceGenerationResult derive(byte[] masterSeed, String sessionId, long pieceIndex) {
        byte[] seed = pieceSeed(masterSeed, pieceIndex, sessionId);
        TetrominoType type = pieceType(seed);
        return new PieceGenerationResult(
                sessionId,
                pieceIndex,
                type,
                proof(seed, sessionId, pieceIndex, type),
                FairnessCrypto.toHex(seed)
        );
    }

    /**
     * Rebuilds the first {@code count} pieces of a session from its revealed round seed.
     *
     * @throws IllegalArgumentException when the seed is not 32 bytes of hex or count is negative
     */
    public static List<PieceGenerationResult> replay(
            String revealedSeedHex,
            String walletAddress,
            Instant startTime,
            String sessionId,
            int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative");
        }
        byte[] roundSeed = FairnessCrypto.decodeHex32(revealedSeedHex);
        byte[] master = masterSeed(roundSeed, walletAddress, startTime);
        try {
            List<PieceGenerationResult> pieces = new ArrayList<>(count);
            for (int index = 0; index < count; index++) {
                pieces.add(derive(master, sessionId, index));
            }
            return pieces;
        } finally {
            Arrays.fill(roundSeed, (byte) 0);
            Arrays.fill(master, (byte) 0);
        }
    }
}
