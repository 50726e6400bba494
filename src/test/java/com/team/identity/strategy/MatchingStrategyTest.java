package com.team.identity.strategy;

import com.team.identity.core.model.ManualMapping;
import com.team.identity.core.model.MatchResult;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.knowledge.InMemoryLearnedMappingRepository;
import com.team.identity.knowledge.KnowledgeBase;
import com.team.identity.rules.NormalizationEngine;
import com.team.identity.rules.TeamNameNormalizationRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Matching strategy tests")
class MatchingStrategyTest {

    private final NormalizationEngine normalizer = TeamNameNormalizationRules.createTeamEngine();
    private KnowledgeBase knowledgeBase;

    @BeforeEach
    void setUp() {
        knowledgeBase = KnowledgeBase.builder()
                .repository(new InMemoryLearnedMappingRepository())
                .builtInMappings(() -> List.of(
                        new ManualMapping("Premier League", "Manchester United", "Manchester Utd"),
                        new ManualMapping("Serie A", "Inter", "Inter Milan")))
                .build();
    }

    @Nested
    @DisplayName("ExactMatchStrategy")
    class ExactTests {

        private final ExactMatchStrategy strategy = new ExactMatchStrategy();

        @Test
        @DisplayName("Should match a byte-for-byte equal candidate")
        void exact() {
            MatchResult result = strategy.attempt("Lazio", List.of("Roma", "Lazio"));

            assertTrue(result.matchFound());
            assertEquals("Lazio", result.matchedName());
            assertEquals(1.0, result.confidence());
            assertEquals(MatchStrategy.EXACT_MATCH, result.strategyUsed());
        }

        @Test
        @DisplayName("Should be case-sensitive")
        void caseSensitive() {
            assertFalse(strategy.attempt("lazio", List.of("Lazio")).matchFound());
        }
    }

    @Nested
    @DisplayName("ManualMappingStrategy")
    class ManualTests {

        @Test
        @DisplayName("Should map when the curated name is offered")
        void mapped() {
            MatchResult result = new ManualMappingStrategy(knowledgeBase)
                    .attempt("Manchester United", List.of("Manchester City", "Manchester Utd"));

            assertTrue(result.matchFound());
            assertEquals("Manchester Utd", result.matchedName());
            assertEquals(0.95, result.confidence());
        }

        @Test
        @DisplayName("Should miss when the curated name is not offered")
        void notOffered() {
            assertFalse(new ManualMappingStrategy(knowledgeBase)
                    .attempt("Inter", List.of("Internazionale")).matchFound());
        }

        @Test
        @DisplayName("Should look up the raw, case-sensitive name")
        void rawKey() {
            assertFalse(new ManualMappingStrategy(knowledgeBase)
                    .attempt("manchester united", List.of("Manchester Utd")).matchFound());
        }
    }

    @Nested
    @DisplayName("LearnedMappingStrategy")
    class LearnedTests {

        @Test
        @DisplayName("Should use a learned mapping when its target is offered")
        void learned() {
            knowledgeBase.recordLearned("Hellas Verona FC", "Hellas Verona", 0.85,
                    MatchStrategy.NORMALIZED_MATCHING, null);

            MatchResult result = new LearnedMappingStrategy(knowledgeBase)
                    .attempt("Hellas Verona FC", List.of("Hellas Verona"));

            assertTrue(result.matchFound());
            assertEquals(0.90, result.confidence());
            assertEquals(MatchStrategy.LEARNED_MAPPING, result.strategyUsed());
        }

        @Test
        @DisplayName("Should miss without a learned mapping")
        void none() {
            assertFalse(new LearnedMappingStrategy(knowledgeBase)
                    .attempt("Hellas Verona FC", List.of("Hellas Verona")).matchFound());
        }
    }

    @Nested
    @DisplayName("NormalizedMatchStrategy")
    class NormalizedTests {

        private final NormalizedMatchStrategy strategy = new NormalizedMatchStrategy(normalizer);

        @Test
        @DisplayName("Should match equal normalized keys at 0.85, first hit wins")
        void firstHit() {
            MatchResult result = strategy.attempt("Sevilla FC", List.of("Betis", "Sevilla", "SEVILLA"));

            assertTrue(result.matchFound());
            assertEquals("Sevilla", result.matchedName());
            assertEquals(0.85, result.confidence());
        }

        @Test
        @DisplayName("A name that normalizes to nothing never matches")
        void emptyKey() {
            assertFalse(strategy.attempt("FC", List.of("Club", "CF")).matchFound());
        }
    }

    @Nested
    @DisplayName("SubstringMatchStrategy")
    class SubstringTests {

        private final SubstringMatchStrategy strategy = new SubstringMatchStrategy(normalizer);

        @Test
        @DisplayName("Confidence should be the length ratio scaled by 0.75")
        void lengthRatio() {
            MatchResult result = strategy.attempt("Inter Milan", List.of("Inter"));

            assertTrue(result.matchFound());
            assertEquals("Inter", result.matchedName());
            assertEquals(5.0 / 11.0 * 0.75, result.confidence(), 0.0001);
        }

        @Test
        @DisplayName("A displaced best should become an alternative")
        void displacedBest() {
            MatchResult result = strategy.attempt("Crystal Palace FC",
                    List.of("Palace", "Crystal Palace", "Dortmund"));

            assertEquals("Crystal Palace", result.matchedName());
            assertEquals(0.75, result.confidence(), 0.0001);
            assertEquals(List.of("Palace"), result.alternatives());
        }

        @Test
        @DisplayName("Weaker runner-ups above the floor should become alternatives")
        void runnerUps() {
            MatchResult result = strategy.attempt("Real Madrid", List.of("Real Madrid CF", "Madrid", "Real"));

            assertEquals("Real Madrid CF", result.matchedName());
            assertEquals(0.75, result.confidence(), 0.0001);
            // "madrid" scores 6/11 * 0.75 = 0.409 (kept); "real" scores 4/11 * 0.75 = 0.273 (dropped)
            assertEquals(List.of("Madrid"), result.alternatives());
        }

        @Test
        @DisplayName("No containment means no match")
        void noContainment() {
            assertFalse(strategy.attempt("Lazio", List.of("Roma", "Napoli")).matchFound());
        }
    }

    @Nested
    @DisplayName("WordOverlapMatchStrategy")
    class WordOverlapTests {

        private final WordOverlapMatchStrategy strategy = new WordOverlapMatchStrategy(normalizer);

        @Test
        @DisplayName("Confidence should be Jaccard scaled by 0.70")
        void jaccardScaled() {
            MatchResult result = strategy.attempt("Athletic Bilbao", List.of("Bilbao"));

            assertTrue(result.matchFound());
            assertEquals(0.5 * 0.70, result.confidence(), 0.0001);
        }

        @Test
        @DisplayName("Other qualifying candidates should become alternatives")
        void alternatives() {
            MatchResult result = strategy.attempt("Real Madrid Castilla",
                    List.of("Real Madrid", "Real Betis Madrid", "Castilla"));

            assertEquals("Real Madrid", result.matchedName());
            assertEquals(List.of("Real Betis Madrid", "Castilla"), result.alternatives());
        }

        @Test
        @DisplayName("Overlap at or below 0.3 should not qualify")
        void belowFloor() {
            assertFalse(strategy.attempt("Borussia Monchengladbach", List.of("Borussia Dortmund Berlin")).matchFound());
        }
    }

    @Nested
    @DisplayName("FuzzyMatchStrategy")
    class FuzzyTests {

        private final FuzzyMatchStrategy strategy = new FuzzyMatchStrategy(normalizer);

        @Test
        @DisplayName("Should rank by ratio and scale by 0.6")
        void ranked() {
            MatchResult result = strategy.attempt("Borussia Monchengladbach",
                    List.of("Dortmund", "B. Monchengladbach"));

            assertTrue(result.matchFound());
            assertEquals("B. Monchengladbach", result.matchedName());
            assertEquals(34.0 / 42.0 * 0.6, result.confidence(), 0.0001);
            assertTrue(result.alternatives().isEmpty());
        }

        @Test
        @DisplayName("A guess under the suggestion floor is not reported as found")
        void belowSuggestionFloor() {
            MatchResult result = strategy.attempt("Arsenal", List.of("Chelsea"));

            assertFalse(result.matchFound());
            assertEquals("Chelsea", result.matchedName());
            assertTrue(result.confidence() > 0.0 && result.confidence() < FuzzyMatchStrategy.SUGGESTION_FLOOR);
        }

        @Test
        @DisplayName("Candidates at or below 0.4 raw similarity are ignored")
        void ignored() {
            MatchResult result = strategy.attempt("Arsenal", List.of("Bayern Munich", "Juventus"));

            assertFalse(result.matchFound());
            assertEquals(0.0, result.confidence());
        }

        @Test
        @DisplayName("Ties should keep candidate order")
        void stableTies() {
            MatchResult result = strategy.attempt("Real Madrid", List.of("Real Madrid CF", "Real Madrid FC"));

            assertEquals("Real Madrid CF", result.matchedName());
            assertEquals(List.of("Real Madrid FC"), result.alternatives());
        }
    }

    @Nested
    @DisplayName("StrategyCascade")
    class CascadeTests {

        @Test
        @DisplayName("Standard cascade should run the seven strategies in priority order")
        void order() {
            StrategyCascade cascade = StrategyCascade.standard(knowledgeBase, normalizer);

            assertEquals(List.of(
                    MatchStrategy.EXACT_MATCH,
                    MatchStrategy.MANUAL_MAPPING,
                    MatchStrategy.LEARNED_MAPPING,
                    MatchStrategy.NORMALIZED_MATCHING,
                    MatchStrategy.SUBSTRING_MATCHING,
                    MatchStrategy.WORD_BASED_MATCHING,
                    MatchStrategy.FUZZY_MATCHING
            ), cascade.strategies().stream().map(MatchingStrategy::tag).toList());
            assertEquals(List.of(1.0, 0.95, 0.90, 0.85, 0.75, 0.70, 0.60),
                    cascade.strategies().stream().map(MatchingStrategy::threshold).toList());
            assertEquals(MatchStrategy.FUZZY_MATCHING, cascade.fallback().tag());
        }

        @Test
        @DisplayName("An empty cascade should be rejected")
        void empty() {
            assertThrows(IllegalArgumentException.class, () -> new StrategyCascade(List.of()));
        }
    }
}
