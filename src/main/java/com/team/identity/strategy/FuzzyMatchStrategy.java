package com.team.identity.strategy;

import com.team.identity.core.model.MatchResult;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.rules.NormalizationEngine;
import com.team.identity.similarity.SequenceMatcherSimilarity;
import com.team.identity.similarity.SimilarityAlgorithm;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Last resort: sequence-matcher ratio between normalized keys, scaled by 0.60.
 *
 * <p>Candidates with a raw ratio above {@value #MIN_SIMILARITY} are ranked (ties keep caller
 * order); the best is the match and the next three the alternatives. Because the orchestrator
 * returns this result even when it misses the threshold, a guess at or above
 * {@value #SUGGESTION_FLOOR} is still reported as found, at its low confidence.</p>
 */
public class FuzzyMatchStrategy implements MatchingStrategy {

    public static final double SCALE = 0.60;
    public static final double MIN_SIMILARITY = 0.4;
    public static final double SUGGESTION_FLOOR = 0.30;

    private final NormalizationEngine normalizer;
    private final SimilarityAlgorithm similarity;

    public FuzzyMatchStrategy(NormalizationEngine normalizer) {
        this(normalizer, new SequenceMatcherSimilarity());
    }

    public FuzzyMatchStrategy(NormalizationEngine normalizer, SimilarityAlgorithm similarity) {
        this.normalizer = normalizer;
        this.similarity = similarity;
    }

    @Override
    public MatchStrategy tag() {
        return MatchStrategy.FUZZY_MATCHING;
    }

    @Override
    public double threshold() {
        return 0.60;
    }

    @Override
    public MatchResult attempt(String sourceName, List<String> candidates) {
        String source = normalizer.normalize(sourceName);
        if (source.isEmpty()) {
            return MatchResult.noMatch(sourceName, tag());
        }

        List<Scored> ranked = new ArrayList<>();
        for (String candidate : candidates) {
            double score = similarity.compute(source, normalizer.normalize(candidate));
            if (score > MIN_SIMILARITY) {
                ranked.add(new Scored(candidate, score));
            }
        }
        if (ranked.isEmpty()) {
            return MatchResult.noMatch(sourceName, tag());
        }

        // List.sort is stable
        ranked.sort(Comparator.comparingDouble(Scored::score).reversed());

        Scored best = ranked.get(0);
        double confidence = best.score() * SCALE;
        List<String> alternatives = ranked.subList(1, ranked.size()).stream()
                .map(Scored::name)
                .limit(MatchResult.MAX_ALTERNATIVES)
                .toList();

        return new MatchResult(sourceName, best.name(), confidence, tag(),
                confidence >= SUGGESTION_FLOOR, alternatives, Duration.ZERO);
    }

    private record Scored(String name, double score) {}
}
