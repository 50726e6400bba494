package com.team.identity.knowledge;

import com.team.identity.core.model.LearnedMapping;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.graph.GraphConnection;
import com.team.identity.graph.PersistenceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Graph-backed {@link LearnedMappingRepository} persisting {@code :LearnedMapping} nodes.
 * A null context is stored as the empty string so it can take part in the MERGE key.
 */
public class GraphLearnedMappingRepository implements LearnedMappingRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphLearnedMappingRepository.class);

    private static final String RETURN_COLUMNS = """
            RETURN m.sourceName as sourceName, m.matchedName as matchedName, m.context as context,
                   m.confidence as confidence, m.strategyUsed as strategyUsed,
                   m.createdAt as createdAt, m.verified as verified
            """;

    private final GraphConnection connection;

    public GraphLearnedMappingRepository(GraphConnection connection) {
        this.connection = connection;
        createIndexes();
    }

    private void createIndexes() {
        safeExecute("CREATE INDEX FOR (m:LearnedMapping) ON (m.sourceName)");
        safeExecute("CREATE INDEX FOR (m:LearnedMapping) ON (m.matchedName)");
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
    public LearnedMapping upsert(LearnedMapping mapping) {
        String query = """
                MERGE (m:LearnedMapping {sourceName: $sourceName, matchedName: $matchedName, context: $context})
                SET m.confidence = $confidence,
                    m.strategyUsed = $strategyUsed,
                    m.createdAt = $createdAt,
                    m.verified = $verified
                """;
        Map<String, Object> params = new HashMap<>(keyParams(
                mapping.sourceName(), mapping.matchedName(), mapping.context()));
        params.put("confidence", mapping.confidence());
        params.put("strategyUsed", mapping.strategyUsed().tag());
        params.put("createdAt", mapping.createdAt().toString());
        params.put("verified", mapping.verified());
        write(query, params);
        log.debug("Upserted learned mapping '{}' -> '{}' (context '{}')",
                mapping.sourceName(), mapping.matchedName(), mapping.context());
        return mapping;
    }

    @Override
    public List<LearnedMapping> findBySourceName(String sourceName) {
        String query = "MATCH (m:LearnedMapping {sourceName: $sourceName})\n" + RETURN_COLUMNS;
        return mapResults(read(query, Map.of("sourceName", sourceName)));
    }

    @Override
    public int deleteBySourceAndMatched(String sourceName, String matchedName) {
        Map<String, Object> params = Map.of("sourceName", sourceName, "matchedName", matchedName);
        List<Map<String, Object>> rows = read("""
                MATCH (m:LearnedMapping {sourceName: $sourceName, matchedName: $matchedName})
                RETURN count(m) as cnt
                """, params);
        write("""
                MATCH (m:LearnedMapping {sourceName: $sourceName, matchedName: $matchedName})
                DELETE m
                """, params);
        return rows.isEmpty() ? 0 : ((Number) rows.get(0).get("cnt")).intValue();
    }

    @Override
    public List<LearnedMapping> findAll() {
        return mapResults(read("MATCH (m:LearnedMapping)\n" + RETURN_COLUMNS, Map.of()));
    }

    @Override
    public int count() {
        List<Map<String, Object>> rows = read("MATCH (m:LearnedMapping) RETURN count(m) as cnt", Map.of());
        if (rows.isEmpty()) {
            return 0;
        }
        return ((Number) rows.get(0).get("cnt")).intValue();
    }

    private static Map<String, Object> keyParams(String sourceName, String matchedName, String context) {
        return Map.of(
                "sourceName", sourceName,
                "matchedName", matchedName,
                "context", context != null ? context : ""
        );
    }

    private void write(String query, Map<String, Object> params) {
        try {
            connection.execute(query, params);
        } catch (PersistenceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceUnavailableException("Learned mapping write failed", e);
        }
    }

    private List<Map<String, Object>> read(String query, Map<String, Object> params) {
        try {
            return connection.query(query, params);
        } catch (PersistenceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceUnavailableException("Learned mapping query failed", e);
        }
    }

    private List<LearnedMapping> mapResults(List<Map<String, Object>> rows) {
        return rows.stream().map(GraphLearnedMappingRepository::toMapping).toList();
    }

    private static LearnedMapping toMapping(Map<String, Object> row) {
        String context = (String) row.get("context");
        String createdAt = (String) row.get("createdAt");
        Object verified = row.get("verified");
        return LearnedMapping.builder()
                .sourceName((String) row.get("sourceName"))
                .matchedName((String) row.get("matchedName"))
                .context(context != null && !context.isEmpty() ? context : null)
                .confidence(((Number) row.get("confidence")).doubleValue())
                .strategyUsed(MatchStrategy.fromTag((String) row.get("strategyUsed")))
                .createdAt(createdAt != null ? Instant.parse(createdAt) : Instant.now())
                .verified(Boolean.TRUE.equals(verified))
                .build();
    }
}
