package com.team.identity.report;

import com.team.identity.attempt.AttemptLogRepository;
import com.team.identity.attempt.AttemptRecord;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.knowledge.KnowledgeBase;
import com.team.identity.logging.LogContext;
import com.team.identity.metrics.MetricsService;
import com.team.identity.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes {@link MappingReport}s from the attempt log.
 * A store failure never reaches the caller: it is logged and an empty report is returned.
 */
public class MappingReportService {
    private static final Logger log = LoggerFactory.getLogger(MappingReportService.class);

    private final AttemptLogRepository attemptLog;
    private final KnowledgeBase knowledgeBase;
    private final MetricsService metricsService;
    private final Clock clock;

    public MappingReportService(AttemptLogRepository attemptLog, KnowledgeBase knowledgeBase) {
        this(attemptLog, knowledgeBase, new NoOpMetricsService(), Clock.systemUTC());
    }

    public MappingReportService(AttemptLogRepository attemptLog, KnowledgeBase knowledgeBase,
                                MetricsService metricsService, Clock clock) {
        this.attemptLog = Objects.requireNonNull(attemptLog, "attemptLog is required");
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Reports on attempts with a timestamp no older than {@code windowDays} days.
     * A negative window yields an empty report.
     */
    public MappingReport report(int windowDays) {
        try (LogContext ignored = LogContext.forReport(windowDays)) {
            Instant now = clock.instant();
            if (windowDays < 0) {
                log.warn("Negative report window {} days, returning an empty report", windowDays);
                return MappingReport.empty(windowDays, now);
            }
            try {
                List<AttemptRecord> records = attemptLog.findSince(now.minus(Duration.ofDays(windowDays)));
                MappingReport report = new MappingReport(
                        windowDays,
                        now,
                        overall(records),
                        strategyPerformance(records),
                        failedMappings(records),
                        recentSuccesses(records),
                        knowledgeBase.manualMappingCount(),
                        knowledgeBase.learnedMappingCount());
                log.info("report.generated windowDays={} attempts={} successRate={}",
                        windowDays, report.overall().totalAttempts(), report.overall().successRate());
                return report;
            } catch (RuntimeException e) {
                log.error("Failed to build mapping report for the last {} days", windowDays, e);
                metricsService.incrementPersistenceFailure("report");
                return MappingReport.empty(windowDays, now);
            }
        }
    }

    private static MappingReport.OverallStats overall(List<AttemptRecord> records) {
        long total = records.size();
        if (total == 0) {
            return MappingReport.OverallStats.EMPTY;
        }
        long successes = records.stream().filter(AttemptRecord::success).count();
        double avgConfidence = records.stream()
                .filter(AttemptRecord::success)
                .mapToDouble(AttemptRecord::confidence)
                .average()
                .orElse(0.0);
        double avgElapsedMillis = records.stream()
                .mapToDouble(r -> r.elapsedTime().toNanos() / 1_000_000.0)
                .average()
                .orElse(0.0);
        return new MappingReport.OverallStats(total, successes, total - successes,
                (double) successes / total, avgConfidence, avgElapsedMillis);
    }

    private static List<MappingReport.StrategyPerformance> strategyPerformance(List<AttemptRecord> records) {
        Map<MatchStrategy, List<AttemptRecord>> byStrategy = new EnumMap<>(MatchStrategy.class);
        for (AttemptRecord record : records) {
            byStrategy.computeIfAbsent(record.strategyUsed(), k -> new ArrayList<>()).add(record);
        }

        List<MappingReport.StrategyPerformance> performance = new ArrayList<>();
        byStrategy.forEach((strategy, attempts) -> {
            long successes = attempts.stream().filter(AttemptRecord::success).count();
            double avgConfidence = attempts.stream()
                    .filter(AttemptRecord::success)
                    .mapToDouble(AttemptRecord::confidence)
                    .average()
                    .orElse(0.0);
            performance.add(new MappingReport.StrategyPerformance(strategy.tag(), attempts.size(),
                    successes, (double) successes / attempts.size(), avgConfidence));
        });
        performance.sort(Comparator.comparingLong(MappingReport.StrategyPerformance::successes).reversed());
        return performance;
    }

    private static List<MappingReport.FailedMapping> failedMappings(List<AttemptRecord> records) {
        Map<FailureKey, Long> counts = new LinkedHashMap<>();
        for (AttemptRecord record : records) {
            if (!record.success()) {
                counts.merge(new FailureKey(record.sourceName(), record.alternatives(), record.context()),
                        1L, Long::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<FailureKey, Long>comparingByValue().reversed())
                .limit(MappingReport.MAX_FAILED_MAPPINGS)
                .map(e -> new MappingReport.FailedMapping(e.getKey().sourceName(),
                        e.getKey().alternatives(), e.getKey().context(), e.getValue()))
                .toList();
    }

    private static List<MappingReport.RecentSuccess> recentSuccesses(List<AttemptRecord> records) {
        return records.stream()
                .filter(AttemptRecord::success)
                .sorted(Comparator.comparing(AttemptRecord::timestamp).reversed())
                .limit(MappingReport.MAX_RECENT_SUCCESSES)
                .map(r -> new MappingReport.RecentSuccess(r.sourceName(), r.matchedName(), r.confidence(),
                        r.strategyUsed().tag(), r.context(), r.timestamp()))
                .toList();
    }

    private record FailureKey(String sourceName, List<String> alternatives, String context) {}
}
