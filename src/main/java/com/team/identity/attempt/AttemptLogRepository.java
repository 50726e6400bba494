package com.team.identity.attempt;

import java.time.Instant;
import java.util.List;

/**
 * Append-only storage for {@link AttemptRecord}s. Records are never updated or deleted.
 */
public interface AttemptLogRepository {

    /**
     * Appends a record.
     *
     * @throws com.team.identity.graph.PersistenceUnavailableException if the store rejects the write
     */
    AttemptRecord save(AttemptRecord record);

    /**
     * Gets records with a timestamp at or after the given instant, oldest first.
     */
    List<AttemptRecord> findSince(Instant since);

    int count();
}
