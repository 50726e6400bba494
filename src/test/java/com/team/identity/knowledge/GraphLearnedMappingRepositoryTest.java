package com.team.identity.knowledge;

import com.team.identity.core.model.LearnedMapping;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.graph.GraphConnection;
import com.team.identity.graph.PersistenceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphLearnedMappingRepository using a stub GraphConnection.
 */
class GraphLearnedMappingRepositoryTest {

    private StubGraphConnection connection;
    private GraphLearnedMappingRepository repository;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        repository = new GraphLearnedMappingRepository(connection);
        connection.executedQueries.clear();
        connection.executedParams.clear();
    }

    @Test
    void constructor_createsIndexes() {
        StubGraphConnection fresh = new StubGraphConnection();
        new GraphLearnedMappingRepository(fresh);

        assertTrue(fresh.executedQueries.stream().anyMatch(q -> q.contains("CREATE INDEX FOR (m:LearnedMapping)")));
    }

    @Test
    void constructor_toleratesExistingIndexes() {
        StubGraphConnection failing = new StubGraphConnection();
        failing.failExecute = true;

        assertDoesNotThrow(() -> new GraphLearnedMappingRepository(failing));
    }

    @Test
    void upsert_mergesOnCompositeKey() {
        LearnedMapping mapping = LearnedMapping.builder()
                .sourceName("Inter")
                .matchedName("Inter Milan")
                .confidence(0.85)
                .strategyUsed(MatchStrategy.NORMALIZED_MATCHING)
                .createdAt(Instant.parse("2024-03-01T12:00:00Z"))
                .build();

        repository.upsert(mapping);

        assertEquals(1, connection.executedQueries.size());
        assertTrue(connection.executedQueries.get(0).contains("MERGE (m:LearnedMapping"));
        Map<String, Object> params = connection.executedParams.get(0);
        assertEquals("Inter", params.get("sourceName"));
        assertEquals("", params.get("context"));
        assertEquals("normalized_matching", params.get("strategyUsed"));
        assertEquals("2024-03-01T12:00:00Z", params.get("createdAt"));
        assertEquals(false, params.get("verified"));
    }

    @Test
    void findBySourceName_mapsRows() {
        connection.queryResults = List.of(
                Map.of("sourceName", "Inter", "matchedName", "Inter Milan", "context", "",
                        "confidence", 1.0, "strategyUsed", "manual_verification",
                        "createdAt", "2024-03-01T12:00:00Z", "verified", true),
                Map.of("sourceName", "Inter", "matchedName", "Internazionale", "context", "Serie A",
                        "confidence", 0.85, "strategyUsed", "normalized_matching",
                        "createdAt", "2024-03-02T12:00:00Z", "verified", false)
        );

        List<LearnedMapping> results = repository.findBySourceName("Inter");

        assertEquals(2, results.size());
        assertNull(results.get(0).context());
        assertTrue(results.get(0).verified());
        assertEquals(MatchStrategy.MANUAL_VERIFICATION, results.get(0).strategyUsed());
        assertEquals("Serie A", results.get(1).context());
        assertEquals(0.85, results.get(1).confidence());
        assertEquals("Inter", connection.executedParams.get(0).get("sourceName"));
    }

    @Test
    void deleteBySourceAndMatched_deletesAcrossContexts() {
        connection.queryResults = List.of(Map.of("cnt", 2L));

        int removed = repository.deleteBySourceAndMatched("Inter", "Inter Milan");

        assertEquals(2, removed);
        assertTrue(connection.executedQueries.stream().anyMatch(q -> q.contains("DELETE m")));
        assertTrue(connection.executedQueries.stream().noneMatch(q -> q.contains("context: $context")));
    }

    @Test
    void count_readsCountColumn() {
        connection.queryResults = List.of(Map.of("cnt", 7L));

        assertEquals(7, repository.count());
    }

    @Test
    void count_returnsZeroWithoutRows() {
        assertEquals(0, repository.count());
    }

    @Test
    void failures_areWrappedAsPersistenceUnavailable() {
        connection.failQuery = true;

        assertThrows(PersistenceUnavailableException.class, () -> repository.findBySourceName("Inter"));
        assertThrows(PersistenceUnavailableException.class, () -> repository.count());
    }

    private static class StubGraphConnection implements GraphConnection {
        final List<String> executedQueries = new ArrayList<>();
        final List<Map<String, Object>> executedParams = new ArrayList<>();
        List<Map<String, Object>> queryResults = List.of();
        boolean failExecute;
        boolean failQuery;

        @Override
        public void execute(String query, Map<String, Object> params) {
            if (failExecute) {
                throw new IllegalStateException("write refused");
            }
            executedQueries.add(query);
            executedParams.add(params);
        }

        @Override
        public List<Map<String, Object>> query(String query, Map<String, Object> params) {
            if (failQuery) {
                throw new IllegalStateException("read refused");
            }
            executedQueries.add(query);
            executedParams.add(params);
            return queryResults;
        }

        @Override
        public boolean isConnected() {
            return true;
        }

        @Override
        public String getGraphName() {
            return "test-graph";
        }

        @Override
        public void close() {
            // no-op
        }
    }
}
