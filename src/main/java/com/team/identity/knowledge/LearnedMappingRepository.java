package com.team.identity.knowledge;

import com.team.identity.core.model.LearnedMapping;

import java.util.List;

/**
 * Storage for learned mappings, unique on (sourceName, matchedName, context).
 * Every method is atomic per record; failures surface as
 * {@link com.team.identity.graph.PersistenceUnavailableException}.
 */
public interface LearnedMappingRepository {

    /**
     * Inserts the mapping, or overwrites the row sharing its key.
     */
    LearnedMapping upsert(LearnedMapping mapping);

    /**
     * Gets every row for a source name across all contexts.
     */
    List<LearnedMapping> findBySourceName(String sourceName);

    /**
     * Deletes every row for the pair regardless of context.
     *
     * @return number of rows removed
     */
    int deleteBySourceAndMatched(String sourceName, String matchedName);

    List<LearnedMapping> findAll();

    int count();
}
