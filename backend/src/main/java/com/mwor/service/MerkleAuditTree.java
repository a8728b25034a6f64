package com.mwor.service;

import com.mwor.model.MerkleTree;
import com.mwor.model.QualifiedWallet;

import java.util.ArrayList;
import java.util.List;

/**
 * SHA-256 Merkle tree over hex leaf hashes. Adjacent nodes are hashed left then right, and an odd
 * level pairs its last node with itself. A proof is the list of siblings from leaf to root; the
 * side of each sibling follows from the leaf index.
 */
public final class MerkleAuditTree {

    public static final String EMPTY_ROOT = "0".repeat(64);

    private MerkleAuditTree() {
    }

    public static String leafHash(String walletAddress, int rank, long score, int tickets) {
        return FairnessCrypto.sha256Hex(walletAddress + ":" + rank + ":" + score + ":" + tickets);
    }

    public static String leafHash(QualifiedWallet wallet) {
        return leafHash(wallet.wallet(), wallet.rank(), wallet.score(), wallet.tickets());
    }

    /**
     * Leaves in the given order, which callers keep as rank order.
     */
    public static List<String> leaves(List<QualifiedWallet> qualified) {
        return qualified.stream().map(MerkleAuditTree::leafHash).toList();
    }

    public static MerkleTree buildTree(List<QualifiedWallet> qualified) {
        return buildTreeFromLeaves(leaves(qualified));
    }

    public static MerkleTree buildTreeFromLeaves(List<String> leaves) {
        if (leaves.isEmpty()) {
            return new MerkleTree(EMPTY_ROOT, List.of(), List.of());
        }
        List<List<String>> levels = new ArrayList<>();
        List<String> level = List.copyOf(leaves);
        levels.add(level);
        while (level.size() > 1) {
            List<String> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                String left = level.get(i);
                String right = i + 1 < level.size() ? level.get(i + 1) : left;
                next.add(hashPair(left, right));
            }
            level = next;
            levels.add(level);
        }
        return new MerkleTree(level.get(0), leaves, levels);
    }

    public static String buildRoot(List<QualifiedWallet> qualified) {
        return buildTree(qualified).root();
    }

    /**
     * Sibling hashes from the leaf at {@code index} up to the root.
     */
    public static List<String> generateMerkleProof(List<String> leaves, int index) {
        if (index < 0 || index >= leaves.size()) {
            throw new IllegalArgumentException("Leaf index " + index + " out of range for " + leaves.size() + " leaves");
        }
        List<List<String>> levels = buildTreeFromLeaves(leaves).levels();
        List<String> proof = new ArrayList<>();
        int position = index;
        for (int depth = 0; depth < levels.size() - 1; depth++) {
            List<String> level = levels.get(depth);
            int sibling = position ^ 1;
            proof.add(sibling < level.size() ? level.get(sibling) : level.get(position));
            position = position / 2;
        }
        return proof;
    }

    /**
     * Qualification leaves are in rank order, so the leaf index is {@code rank - 1}.
     */
    public static boolean verifyProof(
            String walletAddress,
            int rank,
            long score,
            int tickets,
            List<String> proof,
            String root) {
        if (walletAddress == null || rank < 1) {
            return false;
        }
        return verifyLeaf(leafHash(walletAddress, rank, score, tickets), rank - 1, proof, root);
    }

    /**
     * Folds the proof onto the leaf at {@code index} and compares the result with the published
     * root only. Never throws.
     */
    public static boolean verifyLeaf(String leafHash, int index, List<String> proof, String root) {
        if (leafHash == null || proof == null || root == null || index < 0) {
            return false;
        }
        try {
            String hash = FairnessCrypto.normalizeHex32(leafHash);
            long position = index;
            for (String sibling : proof) {
                String siblingHash = FairnessCrypto.normalizeHex32(sibling);
                hash = (position & 1) == 0 ? hashPair(hash, siblingHash) : hashPair(siblingHash, hash);
                position >>= 1;
            }
            // an index beyond the tree width would otherwise fold like a smaller one
            return position == 0
                    && FairnessCrypto.constantTimeEquals(FairnessCrypto.normalizeHex32(root), hash);
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    static String hashPair(String left, String right) {
        return FairnessCrypto.sha256Hex(left + right);
    }
}
