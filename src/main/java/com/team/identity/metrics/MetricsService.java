package com.team.identity.metrics;

import com.team.identity.core.model.MatchStrategy;

import java.time.Duration;

/**
 * Records resolution metrics. The default {@link NoOpMetricsService} does nothing,
 * so the engine runs without a meter registry.
 */
public interface MetricsService {

    void recordResolution(MatchStrategy strategy, boolean matchFound, Duration duration);

    void recordConfidence(double confidence);

    void incrementLearnedMapping(MatchStrategy strategy);

    void incrementVerification(boolean accepted);

    void incrementPersistenceFailure(String operation);
}
