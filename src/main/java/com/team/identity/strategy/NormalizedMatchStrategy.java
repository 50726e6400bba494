package com.team.identity.strategy;

import com.team.identity.core.model.MatchResult;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.rules.NormalizationEngine;

import java.util.List;

/**
 * Equality of normalized keys. The first candidate in caller order wins.
 */
public class NormalizedMatchStrategy implements MatchingStrategy {

    public static final double CONFIDENCE = 0.85;

    private final NormalizationEngine normalizer;

    public NormalizedMatchStrategy(NormalizationEngine normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public MatchStrategy tag() {
        return MatchStrategy.NORMALIZED_MATCHING;
    }

    @Override
    public double threshold() {
        return 0.85;
    }

    @Override
    public MatchResult attempt(String sourceName, List<String> candidates) {
        String normalizedSource = normalizer.normalize(sourceName);
        if (normalizedSource.isEmpty()) {
            return MatchResult.noMatch(sourceName, tag());
        }
        for (String candidate : candidates) {
            if (normalizedSource.equals(normalizer.normalize(candidate))) {
                return MatchResult.matched(sourceName, candidate, CONFIDENCE, tag(), List.of());
            }
        }
        return MatchResult.noMatch(sourceName, tag());
    }
}
