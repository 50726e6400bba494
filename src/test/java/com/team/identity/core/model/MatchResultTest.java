package com.team.identity.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatchResultTest {

    @Test
    @DisplayName("noMatch should carry zero confidence and no names")
    void noMatch() {
        MatchResult result = MatchResult.noMatch("Arsenal", MatchStrategy.FUZZY_MATCHING);

        assertFalse(result.matchFound());
        assertEquals(0.0, result.confidence());
        assertEquals("", result.matchedName());
        assertTrue(result.alternatives().isEmpty());
        assertEquals(Duration.ZERO, result.elapsedTime());
    }

    @Test
    @DisplayName("Alternatives should be capped at three")
    void alternativesCapped() {
        MatchResult result = MatchResult.matched("Inter", "Inter Milan", 0.7, MatchStrategy.WORD_BASED_MATCHING,
                List.of("a", "b", "c", "d", "e"));

        assertEquals(List.of("a", "b", "c"), result.alternatives());
    }

    @Test
    @DisplayName("Should reject confidence outside [0, 1]")
    void invalidConfidence() {
        assertThrows(IllegalArgumentException.class, () ->
                MatchResult.matched("a", "b", 1.5, MatchStrategy.EXACT_MATCH, List.of()));
        assertThrows(IllegalArgumentException.class, () ->
                MatchResult.matched("a", "b", -0.1, MatchStrategy.EXACT_MATCH, List.of()));
    }

    @Test
    @DisplayName("A found match needs a name and a non-zero confidence")
    void foundMatchInvariants() {
        assertThrows(IllegalArgumentException.class, () ->
                MatchResult.matched("a", "", 0.5, MatchStrategy.EXACT_MATCH, List.of()));
        assertThrows(IllegalArgumentException.class, () ->
                MatchResult.matched("a", "b", 0.0, MatchStrategy.EXACT_MATCH, List.of()));
    }

    @Test
    @DisplayName("isAcceptedAt should compare against the threshold inclusively")
    void acceptance() {
        MatchResult result = MatchResult.matched("a", "b", 0.75, MatchStrategy.SUBSTRING_MATCHING, List.of());

        assertTrue(result.isAcceptedAt(0.75));
        assertFalse(result.isAcceptedAt(0.76));
        assertFalse(MatchResult.noMatch("a", MatchStrategy.EXACT_MATCH).isAcceptedAt(0.0));
    }

    @Test
    @DisplayName("withElapsedTime should keep every other field")
    void withElapsedTime() {
        MatchResult result = MatchResult.matched("a", "b", 0.9, MatchStrategy.LEARNED_MAPPING, List.of("c"))
                .withElapsedTime(Duration.ofMillis(3));

        assertEquals(Duration.ofMillis(3), result.elapsedTime());
        assertEquals("b", result.matchedName());
        assertEquals(List.of("c"), result.alternatives());
        assertEquals(MatchStrategy.LEARNED_MAPPING, result.strategyUsed());
    }
}
