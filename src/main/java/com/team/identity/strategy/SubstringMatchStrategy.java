package com.team.identity.strategy;

import com.team.identity.core.model.MatchResult;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.rules.NormalizationEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Containment of one normalized key in the other, scored by length ratio.
 *
 * <p>Confidence is {@code shorter / longer * 0.75}. When a later candidate beats the current
 * best, the displaced best becomes an alternative; other candidates scoring above
 * {@value #ALTERNATIVE_FLOOR} are kept as alternatives too.</p>
 */
public class SubstringMatchStrategy implements MatchingStrategy {

    public static final double SCALE = 0.75;
    public static final double ALTERNATIVE_FLOOR = 0.5 * SCALE;

    private final NormalizationEngine normalizer;

    public SubstringMatchStrategy(NormalizationEngine normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public MatchStrategy tag() {
        return MatchStrategy.SUBSTRING_MATCHING;
    }

    @Override
    public double threshold() {
        return 0.75;
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
            String normalized = normalizer.normalize(candidate);
            if (normalized.isEmpty() || !(source.contains(normalized) || normalized.contains(source))) {
                continue;
            }
            double ratio = (double) Math.min(source.length(), normalized.length())
                    / Math.max(source.length(), normalized.length());
            double confidence = ratio * SCALE;

            if (confidence > bestConfidence) {
                if (best != null) {
                    alternatives.add(best);
                }
                best = candidate;
                bestConfidence = confidence;
            } else if (confidence > ALTERNATIVE_FLOOR) {
                alternatives.add(candidate);
            }
        }

        if (best == null) {
            return MatchResult.noMatch(sourceName, tag());
        }
        return MatchResult.matched(sourceName, best, bestConfidence, tag(), alternatives);
    }
}
