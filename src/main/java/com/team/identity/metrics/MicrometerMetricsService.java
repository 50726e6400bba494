package com.team.identity.metrics;

import com.team.identity.core.model.MatchStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code team.resolution.duration}: Timer (tags: strategy, outcome)</li>
 *   <li>{@code team.resolution.confidence}: DistributionSummary</li>
 *   <li>{@code team.mapping.learned}: Counter (tag: strategy)</li>
 *   <li>{@code team.mapping.verified}: Counter (tag: decision)</li>
 *   <li>{@code team.persistence.failure}: Counter (tag: operation)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary confidenceSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.confidenceSummary = DistributionSummary.builder("team.resolution.confidence")
                .description("Confidence of returned resolution results")
                .register(registry);
    }

    @Override
    public void recordResolution(MatchStrategy strategy, boolean matchFound, Duration duration) {
        String outcome = matchFound ? "matched" : "unmatched";
        Timer timer = timerCache.computeIfAbsent(strategy.tag() + ":" + outcome, k ->
                Timer.builder("team.resolution.duration")
                        .description("End-to-end duration of team name resolution")
                        .tag("strategy", strategy.tag())
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void incrementLearnedMapping(MatchStrategy strategy) {
        counter("learned:" + strategy.tag(), "team.mapping.learned",
                "Mappings promoted into the learned store", "strategy", strategy.tag())
                .increment();
    }

    @Override
    public void incrementVerification(boolean accepted) {
        String decision = accepted ? "accepted" : "rejected";
        counter("verified:" + decision, "team.mapping.verified",
                "Operator verification decisions", "decision", decision)
                .increment();
    }

    @Override
    public void incrementPersistenceFailure(String operation) {
        counter("failure:" + operation, "team.persistence.failure",
                "Failed writes or reads against the mapping store", "operation", operation)
                .increment();
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
