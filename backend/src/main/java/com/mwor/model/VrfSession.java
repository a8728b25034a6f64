package com.mwor.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live VRF session state. The master seed never leaves the process: callers get copies and
 * {@link #expire()} zeroes it on eviction. Mutations of {@code pieceIndex}, {@code state} and the
 * piece history must happen while holding {@link #lock()}.
 */
public class VrfSession {

    private final String sessionId;
    private final String walletAddress;
    private final byte[] masterSeed;
    private final String masterSeedHash;
    private final Instant startTime;
    private final String vrfSignature;
    private final boolean verifiable;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final List<PieceGenerationResult> pieces = new ArrayList<>();

    private volatile long pieceIndex = 0;
    private volatile SessionState state = SessionState.INITIALIZED;

    public VrfSession(
            String sessionId,
            String walletAddress,
            byte[] masterSeed,
            String masterSeedHash,
            Instant startTime,
            String vrfSignature,
            boolean verifiable) {
        this.sessionId = sessionId;
        this.walletAddress = walletAddress;
        this.masterSeed = masterSeed.clone();
        this.masterSeedHash = masterSeedHash;
        this.startTime = startTime;
        this.vrfSignature = vrfSignature;
        this.verifiable = verifiable;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getWalletAddress() {
        return walletAddress;
    }

    public byte[] masterSeed() {
        return masterSeed.clone();
    }

    public String getMasterSeedHash() {
        return masterSeedHash;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public String getVrfSignature() {
        return vrfSignature;
    }

    public boolean isVerifiable() {
        return verifiable;
    }

    public long getPieceIndex() {
        return pieceIndex;
    }

    public SessionState getState() {
        return state;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public void acquire() {
        inFlight.incrementAndGet();
    }

    public void release() {
        inFlight.decrementAndGet();
    }

    public boolean hasInFlightCalls() {
        return inFlight.get() > 0;
    }

    public void recordPiece(PieceGenerationResult piece) {
        pieces.add(piece);
        pieceIndex = piece.pieceIndex() + 1;
        state = SessionState.GENERATING;
    }

    public List<PieceGenerationResult> pieces() {
        return List.copyOf(pieces);
    }

    public int recordedPieceCount() {
        return pieces.size();
    }

    public void markExported() {
        if (state != SessionState.EXPIRED) {
            state = SessionState.EXPORTED;
        }
    }

    public void expire() {
        state = SessionState.EXPIRED;
        wipe();
    }

    private void wipe() {
        Arrays.fill(masterSeed, (byte) 0);
    }

    public SessionSnapshot snapshot() {
        return new SessionSnapshot(
                sessionId,
                walletAddress,
                masterSeedHash,
                pieceIndex,
                startTime,
                vrfSignature,
                verifiable,
                state
        );
    }
}
