package com.team.identity.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Similarity algorithm tests")
class SimilarityAlgorithmTest {

    @Nested
    @DisplayName("JaccardSimilarity")
    class JaccardTests {

        private final JaccardSimilarity jaccard = new JaccardSimilarity();

        @Test
        @DisplayName("Identical word sets score 1.0")
        void identical() {
            assertEquals(1.0, jaccard.compute("real madrid", "madrid real"), 0.0001);
        }

        @Test
        @DisplayName("Partial overlap is intersection over union")
        void partialOverlap() {
            assertEquals(1.0 / 3.0, jaccard.compute("borussia monchengladbach", "b. monchengladbach"), 0.0001);
            assertEquals(2.0 / 3.0, jaccard.compute("west ham utd", "west ham"), 0.0001);
        }

        @Test
        @DisplayName("Empty and null inputs score 0.0")
        void emptyInputs() {
            assertEquals(0.0, jaccard.compute("", ""));
            assertEquals(0.0, jaccard.compute("   ", "lazio"));
            assertEquals(0.0, jaccard.compute(null, "lazio"));
        }

        @Test
        @DisplayName("Words are deduplicated and lowercased")
        void words() {
            assertEquals(Set.of("inter", "milan"), JaccardSimilarity.words("Inter  inter MILAN"));
        }
    }

    @Nested
    @DisplayName("SequenceMatcherSimilarity")
    class SequenceMatcherTests {

        private final SequenceMatcherSimilarity matcher = new SequenceMatcherSimilarity();

        @ParameterizedTest
        @DisplayName("Ratio is 2M/T over all matching blocks")
        @CsvSource({
                "abcd,bcde,0.75",
                "kitten,sitting,0.6153846",
                "abxcd,abcd,0.8888889",
                "borussia monchengladbach,b. monchengladbach,0.8095238",
                "manchester utd,manchester city,0.8275862",
                "arsenal,juventus,0.2666667"
        })
        void knownRatios(String a, String b, double expected) {
            assertEquals(expected, matcher.compute(a, b), 0.00001);
        }

        @Test
        @DisplayName("Two empty strings are identical")
        void bothEmpty() {
            assertEquals(1.0, matcher.compute("", ""));
        }

        @Test
        @DisplayName("One empty string scores 0.0")
        void oneEmpty() {
            assertEquals(0.0, matcher.compute("lazio", ""));
            assertEquals(0.0, matcher.compute(null, "lazio"));
        }

        @Test
        @DisplayName("Matching blocks are counted on both sides of the longest block")
        void recursesAroundLongestBlock() {
            assertEquals(4, matcher.matchingCharacters("abxcd", "abcd"));
            assertEquals(0, matcher.matchingCharacters("abc", "xyz"));
        }
    }
}
