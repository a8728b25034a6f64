package com.mwor.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * The seed authority's beacon for one UTC day. {@code verifiable} is false when the seed came from
 * the local CSPRNG fallback instead of the oracle.
 */
public record DailySeed(
        LocalDate day,
        byte[] seed,
        byte[] vrfProof,
        String vrfSignature,
        Instant createdAt,
        Instant rotatesAt,
        boolean verifiable,
        boolean active
) {

    public DailySeed {
        seed = seed.clone();
        vrfProof = vrfProof == null ? new byte[0] : vrfProof.clone();
    }

    @Override
    public byte[] seed() {
        return seed.clone();
    }

    @Override
    public byte[] vrfProof() {
        return vrfProof.clone();
    }

    public DailySeed retire() {
        return new DailySeed(day, seed, vrfProof, vrfSignature, createdAt, rotatesAt, verifiable, false);
    }
}
