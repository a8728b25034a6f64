package com.mwor.repository;

import com.mwor.model.PlayRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
@ConditionalOnProperty(
        prefix = "mwor.plays",
        name = "store",
        havingValue = "in_memory",
        matchIfMissing = true
)
public class InMemoryPlayRecordStore implements PlayRecordSource {

    private final List<PlayRecord> plays = new CopyOnWriteArrayList<>();

    @Override
    public List<PlayRecord> findPlaysBetween(Instant fromInclusive, Instant toExclusive) {
        return plays.stream()
                .filter(play -> !play.timestamp().isBefore(fromInclusive) && play.timestamp().isBefore(toExclusive))
                .toList();
    }

    @Override
    public void record(PlayRecord playRecord) {
        plays.add(Objects.requireNonNull(playRecord, "playRecord is required"));
    }
}
