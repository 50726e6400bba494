package com.team.identity.report;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate view of the attempt log over a time window.
 *
 * @param periodDays          the window the report covers, in days back from {@code generatedAt}
 * @param generatedAt         when the report was computed
 * @param overall             totals and averages over the window
 * @param strategyPerformance per-strategy breakdown, most successes first
 * @param failedMappings      most frequent failing (source, alternatives, context) groups
 * @param recentSuccesses     latest successful attempts, newest first
 * @param manualMappingCount  current size of the manual table
 * @param learnedMappingCount current size of the learned table
 */
public record MappingReport(
        int periodDays,
        Instant generatedAt,
        OverallStats overall,
        List<StrategyPerformance> strategyPerformance,
        List<FailedMapping> failedMappings,
        List<RecentSuccess> recentSuccesses,
        int manualMappingCount,
        int learnedMappingCount
) {
    public static final int MAX_FAILED_MAPPINGS = 20;
    public static final int MAX_RECENT_SUCCESSES = 10;

    public MappingReport {
        Objects.requireNonNull(generatedAt, "generatedAt is required");
        Objects.requireNonNull(overall, "overall is required");
        strategyPerformance = strategyPerformance != null ? List.copyOf(strategyPerformance) : List.of();
        failedMappings = failedMappings != null ? List.copyOf(failedMappings) : List.of();
        recentSuccesses = recentSuccesses != null ? List.copyOf(recentSuccesses) : List.of();
    }

    /**
     * The zero-valued report returned when the attempt log cannot be read or the window is invalid.
     */
    public static MappingReport empty(int periodDays, Instant generatedAt) {
        return new MappingReport(periodDays, generatedAt, OverallStats.EMPTY,
                List.of(), List.of(), List.of(), 0, 0);
    }

    public record OverallStats(
            long totalAttempts,
            long successfulMappings,
            long failedMappings,
            double successRate,
            double avgConfidence,
            double avgElapsedMillis
    ) {
        public static final OverallStats EMPTY = new OverallStats(0, 0, 0, 0.0, 0.0, 0.0);
    }

    /**
     * @param strategy      the strategy tag, e.g. {@code fuzzy_matching}
     * @param avgConfidence mean confidence over this strategy's successful attempts
     */
    public record StrategyPerformance(
            String strategy,
            long attempts,
            long successes,
            double successRate,
            double avgConfidence
    ) {}

    public record FailedMapping(
            String sourceName,
            List<String> alternatives,
            String context,
            long count
    ) {
        public FailedMapping {
            alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
        }
    }

    public record RecentSuccess(
            String sourceName,
            String matchedName,
            double confidence,
            String strategy,
            String context,
            Instant timestamp
    ) {}
}
