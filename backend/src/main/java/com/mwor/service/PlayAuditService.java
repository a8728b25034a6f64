package com.mwor.service;

import com.mwor.model.GameMove;
import com.mwor.model.PlayRecord;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Audit hashes over finished plays: a digest of each move sequence and a daily Merkle root over
 * the play records, suitable for anchoring on chain.
 */
@Service
public class PlayAuditService {

    public String hashMoveSequence(List<GameMove> moves) {
        String moveData = moves.stream()
                .map(move -> move.type().name() + ":" + move.timestamp() + ":"
                        + nullToEmpty(move.direction()) + ":" + nullToEmpty(move.rotation()))
                .collect(Collectors.joining("|"));
        return FairnessCrypto.sha256Hex(moveData);
    }

    public String playLeaf(PlayRecord play) {
        return FairnessCrypto.sha256Hex(play.walletAddress() + ":" + play.score() + ":" + play.seedHash() + ":"
                + play.timestamp().toEpochMilli());
    }

    public String buildDailyPlayRoot(List<PlayRecord> plays) {
        return MerkleAuditTree.buildTreeFromLeaves(plays.stream().map(this::playLeaf).toList()).root();
    }

    /**
     * Membership proof for the play at {@code index}, for dispute resolution.
     */
    public List<String> generatePlayProof(List<PlayRecord> plays, int index) {
        return MerkleAuditTree.generateMerkleProof(plays.stream().map(this::playLeaf).toList(), index);
    }

    public boolean verifyPlay(PlayRecord play, int index, List<String> proof, String root) {
        return play != null && MerkleAuditTree.verifyLeaf(playLeaf(play), index, proof, root);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
