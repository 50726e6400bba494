package com.team.identity.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class MatchStrategyTest {

    @ParameterizedTest
    @EnumSource(MatchStrategy.class)
    @DisplayName("Every tag should resolve back to its constant")
    void tagsRoundTrip(MatchStrategy strategy) {
        assertSame(strategy, MatchStrategy.fromTag(strategy.tag()));
    }

    @Test
    @DisplayName("Tags should use the persisted snake_case names")
    void tagNames() {
        assertEquals("word_based_matching", MatchStrategy.WORD_BASED_MATCHING.tag());
        assertEquals("manual_verification", MatchStrategy.MANUAL_VERIFICATION.toString());
    }

    @Test
    @DisplayName("Unknown tags should be rejected")
    void unknownTag() {
        assertThrows(IllegalArgumentException.class, () -> MatchStrategy.fromTag("guesswork"));
    }

    @Test
    @DisplayName("LearnedMapping key should include the context")
    void learnedMappingKey() {
        LearnedMapping inLeague = LearnedMapping.builder()
                .sourceName("Inter").matchedName("Inter Milan").confidence(0.85)
                .strategyUsed(MatchStrategy.NORMALIZED_MATCHING).context("Serie A").build();
        LearnedMapping noContext = LearnedMapping.builder()
                .sourceName("Inter").matchedName("Inter Milan").confidence(0.85)
                .strategyUsed(MatchStrategy.NORMALIZED_MATCHING).build();

        assertNotEquals(inLeague.key(), noContext.key());
        assertNotNull(noContext.createdAt());
    }
}
