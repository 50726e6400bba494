package com.team.identity.strategy;

import com.team.identity.core.model.MatchResult;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.rules.NormalizationEngine;
import com.team.identity.similarity.JaccardSimilarity;
import com.team.identity.similarity.SimilarityAlgorithm;

import java.util.ArrayList;
import java.util.List;

/**
 * Jaccard overlap of the normalized word sets, scaled by 0.70.
 * Only candidates whose raw overlap exceeds {@value #MIN_SIMILARITY} are considered.
 */
public class WordOverlapMatchStrategy implements MatchingStrategy {

    public static final double SCALE = 0.70;
    public static final double MIN_SIMILARITY = 0.3;

    private final NormalizationEngine normalizer;
    private final SimilarityAlgorithm similarity;

    public WordOverlapMatchStrategy(NormalizationEngine normalizer) {
        this(normalizer, new JaccardSimilarity());
    }

    public WordOverlapMatchStrategy(NormalizationEngine normalizer, SimilarityAlgorithm similarity) {
        this.normalizer = normalizer;
        this.similarity = similarity;
    }

    @Override
    public MatchStrategy tag() {
        return MatchStrategy.WORD_BASED_MATCHING;
    }

    @Override
    public double threshold() {
        return 0.70;
    }

    @Override
    public MatchResult attempt(String sourceName, List<String> candidates) {
        String source = normalizer.normalize(sourceName);
        if (source.isEmpty()) {
            return MatchResult.noMatch(sourceName, tag());
        }

        String best = null;
        double bestConfidence = 0.0;
        List<String> alternatives = new ArrayList<>();

        for (String candidate : candidates) {
            double score = similarity.compute(source, normalizer.normalize(candidate));
            if (score <= MIN_SIMILARITY) {
                continue;
            }
            double confidence = score * SCALE;
            if (confidence > bestConfidence) {
                if (best != null) {
                    alternatives.add(best);
                }
                best = candidate;
                bestConfidence = confidence;
            } else {
                alternatives.add(candidate);
            }
        }

        if (best == null) {
            return MatchResult.noMatch(sourceName, tag());
        }
        return MatchResult.matched(sourceName, best, bestConfidence, tag(), alternatives);
    }
}
