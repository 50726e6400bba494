package com.team.identity.knowledge;

import com.team.identity.core.model.LearnedMapping;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link LearnedMappingRepository}.
 * Thread-safe via ConcurrentHashMap; state is lost with the process.
 */
public class InMemoryLearnedMappingRepository implements LearnedMappingRepository {

    private final ConcurrentMap<LearnedMapping.Key, LearnedMapping> mappings = new ConcurrentHashMap<>();

    @Override
    public LearnedMapping upsert(LearnedMapping mapping) {
        mappings.put(mapping.key(), mapping);
        return mapping;
    }

    @Override
    public List<LearnedMapping> findBySourceName(String sourceName) {
        return mappings.values().stream()
                .filter(m -> m.sourceName().equals(sourceName))
                .toList();
    }

    @Override
    public int deleteBySourceAndMatched(String sourceName, String matchedName) {
        int removed = 0;
        for (LearnedMapping.Key key : mappings.keySet()) {
            if (key.sourceName().equals(sourceName) && key.matchedName().equals(matchedName)
                    && mappings.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public List<LearnedMapping> findAll() {
        return List.copyOf(mappings.values());
    }

    @Override
    public int count() {
        return mappings.size();
    }
}
