package com.team.identity.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one strategy attempt, or of a whole resolution call once the
 * orchestrator has stamped the elapsed time on it.
 *
 * @param sourceName   the provider name being resolved
 * @param matchedName  the chosen candidate, empty when nothing matched
 * @param confidence   trust in the match, between 0.0 and 1.0
 * @param strategyUsed the strategy that produced this result
 * @param matchFound   whether a candidate was chosen
 * @param alternatives up to {@value #MAX_ALTERNATIVES} next-best candidate names
 * @param elapsedTime  wall time spent producing the result
 */
public record MatchResult(
        String sourceName,
        String matchedName,
        double confidence,
        MatchStrategy strategyUsed,
        boolean matchFound,
        List<String> alternatives,
        Duration elapsedTime
) {
    public static final int MAX_ALTERNATIVES = 3;

    public MatchResult {
        Objects.requireNonNull(strategyUsed, "strategyUsed is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got " + confidence);
        }
        matchedName = matchedName != null ? matchedName : "";
        if (matchFound && matchedName.isEmpty()) {
            throw new IllegalArgumentException("A found match requires a matched name");
        }
        if (matchFound && confidence == 0.0) {
            throw new IllegalArgumentException("A found match requires a non-zero confidence");
        }
        alternatives = alternatives == null ? List.of()
                : List.copyOf(alternatives.size() > MAX_ALTERNATIVES
                        ? alternatives.subList(0, MAX_ALTERNATIVES) : alternatives);
        elapsedTime = elapsedTime != null ? elapsedTime : Duration.ZERO;
    }

    /**
     * Creates the empty result a strategy returns when no candidate qualifies.
     */
    public static MatchResult noMatch(String sourceName, MatchStrategy strategy) {
        return new MatchResult(sourceName, "", 0.0, strategy, false, List.of(), Duration.ZERO);
    }

    /**
     * Creates a result for a chosen candidate.
     */
    public static MatchResult matched(String sourceName, String matchedName, double confidence,
                                      MatchStrategy strategy, List<String> alternatives) {
        return new MatchResult(sourceName, matchedName, confidence, strategy, true, alternatives, Duration.ZERO);
    }

    /**
     * Returns a copy carrying the given elapsed time.
     */
    public MatchResult withElapsedTime(Duration elapsed) {
        return new MatchResult(sourceName, matchedName, confidence, strategyUsed, matchFound, alternatives, elapsed);
    }

    /**
     * Returns true if the result clears the given acceptance threshold.
     */
    public boolean isAcceptedAt(double threshold) {
        return matchFound && confidence >= threshold;
    }
}
