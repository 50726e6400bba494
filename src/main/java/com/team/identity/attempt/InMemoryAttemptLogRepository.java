package com.team.identity.attempt;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link AttemptLogRepository}.
 * Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryAttemptLogRepository implements AttemptLogRepository {

    private final List<AttemptRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public AttemptRecord save(AttemptRecord record) {
        records.add(record);
        return record;
    }

    @Override
    public List<AttemptRecord> findSince(Instant since) {
        return records.stream()
                .filter(r -> !r.timestamp().isBefore(since))
                .sorted(Comparator.comparing(AttemptRecord::timestamp))
                .toList();
    }

    @Override
    public int count() {
        return records.size();
    }
}
