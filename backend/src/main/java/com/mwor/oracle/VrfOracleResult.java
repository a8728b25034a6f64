package com.mwor.oracle;

/**
 * Raw oracle answer: 32 bytes of randomness, the oracle's proof bytes and its signature reference.
 */
public record VrfOracleResult(byte[] randomness, byte[] proof, String signature) {

    public VrfOracleResult {
        randomness = randomness == null ? null : randomness.clone();
        proof = proof == null ? null : proof.clone();
    }

    @Override
    public byte[] randomness() {
        return randomness == null ? null : randomness.clone();
    }

    @Override
    public byte[] proof() {
        return proof == null ? null : proof.clone();
    }
}
