package com.team.identity.attempt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.graph.GraphConnection;
import com.team.identity.graph.PersistenceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Graph-backed {@link AttemptLogRepository} persisting {@code :MappingAttempt} nodes.
 * Alternatives are stored as a JSON array string; timestamps as epoch milliseconds so
 * the window filter compares numbers. Sub-millisecond precision is not kept.
 */
public class GraphAttemptLogRepository implements AttemptLogRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphAttemptLogRepository.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphAttemptLogRepository(GraphConnection connection) {
        this.connection = connection;
        this.objectMapper = new ObjectMapper();
        createIndexes();
    }

    private void createIndexes() {
        safeExecute("CREATE INDEX FOR (a:MappingAttempt) ON (a.id)");
        safeExecute("CREATE INDEX FOR (a:MappingAttempt) ON (a.timestamp)");
    }

    private void safeExecute(String query) {
        try {
            connection.execute(query);
        } catch (RuntimeException e) {
            // FalkorDB rejects CREATE INDEX for an index that already exists
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public AttemptRecord save(AttemptRecord record) {
        String query = """
                CREATE (a:MappingAttempt {
                    id: $id,
                    sourceName: $sourceName,
                    matchedName: $matchedName,
                    confidence: $confidence,
                    strategyUsed: $strategyUsed,
                    success: $success,
                    elapsedNanos: $elapsedNanos,
                    alternatives: $alternatives,
                    context: $context,
                    timestamp: $timestamp
                })
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("id", record.id());
        params.put("sourceName", record.sourceName());
        params.put("matchedName", record.matchedName() != null ? record.matchedName() : "");
        params.put("confidence", record.confidence());
        params.put("strategyUsed", record.strategyUsed().tag());
        params.put("success", record.success());
        params.put("elapsedNanos", record.elapsedTime().toNanos());
        params.put("alternatives", serializeAlternatives(record.alternatives()));
        params.put("context", record.context() != null ? record.context() : "");
        params.put("timestamp", record.timestamp().toEpochMilli());
        try {
            connection.execute(query, params);
        } catch (PersistenceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceUnavailableException("Attempt log write failed", e);
        }
        log.debug("Persisted attempt {} for '{}' via {}", record.id(), record.sourceName(), record.strategyUsed());
        return record;
    }

    @Override
    public List<AttemptRecord> findSince(Instant since) {
        String query = """
                MATCH (a:MappingAttempt)
                WHERE a.timestamp >= $since
                RETURN a.id as id, a.sourceName as sourceName, a.matchedName as matchedName,
                       a.confidence as confidence, a.strategyUsed as strategyUsed, a.success as success,
                       a.elapsedNanos as elapsedNanos, a.alternatives as alternatives,
                       a.context as context, a.timestamp as timestamp
                ORDER BY a.timestamp ASC
                """;
        return query(query, Map.of("since", since.toEpochMilli())).stream()
                .map(this::toRecord)
                .toList();
    }

    @Override
    public int count() {
        List<Map<String, Object>> rows = query("MATCH (a:MappingAttempt) RETURN count(a) as cnt", Map.of());
        if (rows.isEmpty()) {
            return 0;
        }
        return ((Number) rows.get(0).get("cnt")).intValue();
    }

    private List<Map<String, Object>> query(String query, Map<String, Object> params) {
        try {
            return connection.query(query, params);
        } catch (PersistenceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceUnavailableException("Attempt log query failed", e);
        }
    }

    private AttemptRecord toRecord(Map<String, Object> row) {
        String matchedName = (String) row.get("matchedName");
        String context = (String) row.get("context");
        Object elapsed = row.get("elapsedNanos");
        return AttemptRecord.builder()
                .id((String) row.get("id"))
                .sourceName((String) row.get("sourceName"))
                .matchedName(matchedName != null && !matchedName.isEmpty() ? matchedName : null)
                .confidence(((Number) row.get("confidence")).doubleValue())
                .strategyUsed(MatchStrategy.fromTag((String) row.get("strategyUsed")))
                .success(Boolean.TRUE.equals(row.get("success")))
                .elapsedTime(elapsed != null ? Duration.ofNanos(((Number) elapsed).longValue()) : Duration.ZERO)
                .alternatives(deserializeAlternatives((String) row.get("alternatives")))
                .context(context != null && !context.isEmpty() ? context : null)
                .timestamp(Instant.ofEpochMilli(((Number) row.get("timestamp")).longValue()))
                .build();
    }

    private String serializeAlternatives(List<String> alternatives) {
        try {
            return objectMapper.writeValueAsString(alternatives);
        } catch (JsonProcessingException e) {
            throw new PersistenceUnavailableException("Cannot serialize alternatives", e);
        }
    }

    private List<String> deserializeAlternatives(String json) {
        if (json == null || json.isEmpty()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable alternatives on attempt record: {}", e.getMessage());
            return List.of();
        }
    }
}
