package com.team.identity.attempt;

import com.team.identity.core.model.MatchResult;
import com.team.identity.core.model.MatchStrategy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One append-only entry of the attempt log, written for every resolution call.
 *
 * @param matchedName the chosen name, or null when nothing was matched
 */
public record AttemptRecord(
        String id,
        String sourceName,
        String matchedName,
        double confidence,
        MatchStrategy strategyUsed,
        boolean success,
        Duration elapsedTime,
        List<String> alternatives,
        String context,
        Instant timestamp
) {
    public AttemptRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(strategyUsed, "strategyUsed is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        elapsedTime = elapsedTime != null ? elapsedTime : Duration.ZERO;
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
        if (matchedName != null && matchedName.isEmpty()) {
            matchedName = null;
        }
    }

    /**
     * Builds the log entry for a finished resolution.
     */
    public static AttemptRecord of(MatchResult result, String context, Instant timestamp) {
        return builder()
                .sourceName(result.sourceName())
                .matchedName(result.matchFound() ? result.matchedName() : null)
                .confidence(result.confidence())
                .strategyUsed(result.strategyUsed())
                .success(result.matchFound())
                .elapsedTime(result.elapsedTime())
                .alternatives(result.alternatives())
                .context(context)
                .timestamp(timestamp)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String sourceName;
        private String matchedName;
        private double confidence;
        private MatchStrategy strategyUsed;
        private boolean success;
        private Duration elapsedTime = Duration.ZERO;
        private List<String> alternatives = List.of();
        private String context;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder matchedName(String matchedName) {
            this.matchedName = matchedName;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder strategyUsed(MatchStrategy strategyUsed) {
            this.strategyUsed = strategyUsed;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder elapsedTime(Duration elapsedTime) {
            this.elapsedTime = elapsedTime;
            return this;
        }

        public Builder alternatives(List<String> alternatives) {
            this.alternatives = alternatives;
            return this;
        }

        public Builder context(String context) {
            this.context = context;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AttemptRecord build() {
            return new AttemptRecord(id, sourceName, matchedName, confidence, strategyUsed, success,
                    elapsedTime, alternatives, context, timestamp);
        }
    }
}
