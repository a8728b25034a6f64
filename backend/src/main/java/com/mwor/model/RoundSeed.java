package com.mwor.model;

import java.time.LocalDate;

/**
 * Per-(wallet, session) seed derived from the day's beacon.
 */
public record RoundSeed(byte[] seed, LocalDate day, String vrfSignature, boolean verifiable) {

    public RoundSeed {
        seed = seed.clone();
    }

    @Override
    public byte[] seed() {
        return seed.clone();
    }
}
