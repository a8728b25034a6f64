package com.mwor.repository;

import com.mwor.model.Commitment;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Repository
public class InMemoryCommitmentRepository implements CommitmentRepository {

    private final ConcurrentMap<String, Commitment> commitments = new ConcurrentHashMap<>();

    @Override
    public Optional<Commitment> findBySessionId(String sessionId) {
        return Optional.ofNullable(commitments.get(sessionId));
    }

    @Override
    public Commitment saveIfAbsent(Commitment commitment) {
        Objects.requireNonNull(commitment, "commitment is required");
        Commitment existing = commitments.putIfAbsent(commitment.getSessionId(), commitment);
        return existing != null ? existing : commitment;
    }

    @Override
    public Commitment save(Commitment commitment) {
        Objects.requireNonNull(commitment, "commitment is required");
        commitments.put(commitment.getSessionId(), commitment);
        return commitment;
    }

    @Override
    public List<Commitment> findByCommittedAtBefore(OffsetDateTime cutoff) {
        return commitments.values().stream()
                .filter(commitment -> commitment.getCommittedAt().isBefore(cutoff))
                .toList();
    }

    @Override
    public void deleteBySessionId(String sessionId) {
        commitments.remove(sessionId);
    }
}
