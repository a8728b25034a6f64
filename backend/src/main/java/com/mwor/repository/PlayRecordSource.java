package com.mwor.repository;

import com.mwor.model.PlayRecord;

import java.time.Instant;
import java.util.List;

/**
 * Supplies persisted play records and accepts new ones.
 */
public interface PlayRecordSource {

    List<PlayRecord> findPlaysBetween(Instant fromInclusive, Instant toExclusive);

    void record(PlayRecord playRecord);
}
