package com.mwor.repository;

import com.mwor.model.Commitment;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Storage for seed commitments. Raw seeds are stored only as encrypted envelopes, so a shared
 * store can back several service instances.
 */
public interface CommitmentRepository {

    Optional<Commitment> findBySessionId(String sessionId);

    /**
     * Stores the commitment unless one already exists for its session.
     *
     * @return the commitment now stored for the session
     */
    Commitment saveIfAbsent(Commitment commitment);

    Commitment save(Commitment commitment);

    List<Commitment> findByCommittedAtBefore(OffsetDateTime cutoff);

    void deleteBySessionId(String sessionId);
}
