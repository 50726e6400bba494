package com.team.identity.strategy;

import com.team.identity.core.model.MatchResult;
import com.team.identity.core.model.MatchStrategy;

import java.util.List;

/**
 * Byte-for-byte, case-sensitive equality with a candidate.
 */
public class ExactMatchStrategy implements MatchingStrategy {

    public static final double CONFIDENCE = 1.0;

    @Override
    public MatchStrategy tag() {
        return MatchStrategy.EXACT_MATCH;
    }

    @Override
    public double threshold() {
        return 1.0;
    }

    @Override
    public MatchResult attempt(String sourceName, List<String> candidates) {
        if (candidates.contains(sourceName)) {
            return MatchResult.matched(sourceName, sourceName, CONFIDENCE, tag(), List.of());
        }
        return MatchResult.noMatch(sourceName, tag());
    }
}
