package com.mwor.model;

import java.util.List;

/**
 * A qualified wallet together with its Merkle membership proof against the day's root.
 */
public record RaffleQualification(
        QualifiedWallet wallet,
        List<String> merkleProof
) {
}
