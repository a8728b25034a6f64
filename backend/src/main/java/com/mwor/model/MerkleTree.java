package com.mwor.model;

import java.util.List;

/**
 * Immutable Merkle tree. {@code levels.get(0)} holds the leaves, the last level holds the root.
 */
public record MerkleTree(String root, List<String> leaves, List<List<String>> levels) {

    public MerkleTree {
        leaves = List.copyOf(leaves);
        levels = levels.stream().map(List::copyOf).toList();
    }

    public List<String> nodes() {
        return levels.stream().flatMap(List::stream).toList();
    }
}
