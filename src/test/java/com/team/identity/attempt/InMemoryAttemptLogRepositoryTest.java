package com.team.identity.attempt;

import com.team.identity.core.model.MatchResult;
import com.team.identity.core.model.MatchStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryAttemptLogRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private final InMemoryAttemptLogRepository repository = new InMemoryAttemptLogRepository();

    private static AttemptRecord record(String source, Instant timestamp) {
        return AttemptRecord.builder()
                .sourceName(source)
                .strategyUsed(MatchStrategy.EXACT_MATCH)
                .success(true)
                .matchedName(source)
                .confidence(1.0)
                .timestamp(timestamp)
                .build();
    }

    @Test
    @DisplayName("findSince should be inclusive and ordered oldest first")
    void findSince() {
        repository.save(record("Late", T0.plusSeconds(60)));
        repository.save(record("Early", T0.minusSeconds(60)));
        repository.save(record("Boundary", T0));

        List<AttemptRecord> records = repository.findSince(T0);

        assertEquals(List.of("Boundary", "Late"), records.stream().map(AttemptRecord::sourceName).toList());
        assertEquals(3, repository.count());
    }

    @Test
    @DisplayName("Records built from a failed result carry no matched name")
    void fromFailedResult() {
        MatchResult result = MatchResult.noMatch("Arsenal", MatchStrategy.FUZZY_MATCHING);

        AttemptRecord record = AttemptRecord.of(result, "Premier League", T0);

        assertNull(record.matchedName());
        assertFalse(record.success());
        assertEquals(MatchStrategy.FUZZY_MATCHING, record.strategyUsed());
        assertEquals("Premier League", record.context());
        assertNotNull(record.id());
    }

    @Test
    @DisplayName("Each record gets its own id")
    void uniqueIds() {
        AttemptRecord first = record("Inter", T0);
        AttemptRecord second = record("Inter", T0);

        assertNotEquals(first.id(), second.id());
    }
}
