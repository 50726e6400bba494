package com.team.identity.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A mapping discovered at runtime (or confirmed by an operator) and persisted for reuse.
 * Unique on {@code (sourceName, matchedName, context)}.
 */
public record LearnedMapping(
        String sourceName,
        String matchedName,
        double confidence,
        MatchStrategy strategyUsed,
        Instant createdAt,
        boolean verified,
        String context
) {
    public LearnedMapping {
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(matchedName, "matchedName is required");
        Objects.requireNonNull(strategyUsed, "strategyUsed is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public Key key() {
        return new Key(sourceName, matchedName, context);
    }

    /**
     * Composite uniqueness key. A null context is a scope of its own.
     */
    public record Key(String sourceName, String matchedName, String context) {
        public Key {
            Objects.requireNonNull(sourceName, "sourceName is required");
            Objects.requireNonNull(matchedName, "matchedName is required");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceName;
        private String matchedName;
        private double confidence;
        private MatchStrategy strategyUsed;
        private Instant createdAt = Instant.now();
        private boolean verified;
        private String context;

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

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder verified(boolean verified) {
            this.verified = verified;
            return this;
        }

        public Builder context(String context) {
            this.context = context;
            return this;
        }

        public LearnedMapping build() {
            return new LearnedMapping(sourceName, matchedName, confidence, strategyUsed,
                    createdAt, verified, context);
        }
    }
}
