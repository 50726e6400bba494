package com.team.identity.metrics;

import com.team.identity.core.model.MatchStrategy;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolution(MatchStrategy strategy, boolean matchFound, Duration duration) {
    }

    @Override
    public void recordConfidence(double confidence) {
    }

    @Override
    public void incrementLearnedMapping(MatchStrategy strategy) {
    }

    @Override
    public void incrementVerification(boolean accepted) {
    }

    @Override
    public void incrementPersistenceFailure(String operation) {
    }
}
