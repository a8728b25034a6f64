package com.mwor.model;

/**
 * VRF session lifecycle: INITIALIZED -> GENERATING -> EXPORTED -> EXPIRED.
 * EXPIRED is terminal.
 */
public enum SessionState {
    INITIALIZED,
    GENERATING,
    EXPORTED,
    EXPIRED;

    public boolean canGenerate() {
        return this == INITIALIZED || this == GENERATING;
    }
}
