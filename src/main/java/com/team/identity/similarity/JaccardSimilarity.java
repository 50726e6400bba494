package com.team.identity.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard similarity over word sets.
 * Computes |intersection| / |union| of whitespace-separated words.
 * Two names without any words score 0.0, never 1.0.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }

        Set<String> words1 = words(s1);
        Set<String> words2 = words(s2);

        if (words1.isEmpty() || words2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (String word : words1) {
            if (words2.contains(word)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = words1.size() + words2.size() - intersectionSize;

        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    /**
     * Splits a name into its distinct lowercase words.
     */
    public static Set<String> words(String s) {
        Set<String> words = new LinkedHashSet<>();
        for (String token : WHITESPACE.split(s.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                words.add(token);
            }
        }
        return words;
    }
}
