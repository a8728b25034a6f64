package com.mwor.model;

/**
 * Randomness handed to a raffle draw, with the oracle signature it is attributed to.
 */
public record VrfRandomness(byte[] value, String signature, boolean verifiable) {

    public VrfRandomness {
        value = value.clone();
    }

    @Override
    public byte[] value() {
        return value.clone();
    }
}
