package com.team.identity.api;

import java.nio.file.Path;
import java.util.Properties;

/**
 * Engine-wide settings: manual mapping overrides, learning, cache sizing and persistence.
 */
public class EngineConfig {

    public static final String OVERRIDE_FILE = "team.identity.override-file";
    public static final String LEARNING_ENABLED = "team.identity.learning.enabled";
    public static final String LEARNING_CONFIDENCE_FLOOR = "team.identity.learning.confidence-floor";
    public static final String LEARNED_CACHE_MAX_SIZE = "team.identity.learned-cache.max-size";
    public static final String PERSISTENCE_THREADS = "team.identity.persistence.threads";
    public static final String PERSISTENCE_SYNCHRONOUS = "team.identity.persistence.synchronous";

    private static final double DEFAULT_LEARNING_CONFIDENCE_FLOOR = 0.8;
    private static final int DEFAULT_LEARNED_CACHE_MAX_SIZE = 10_000;
    private static final int DEFAULT_PERSISTENCE_THREADS = 1;

    private final Path overrideFile;
    private final boolean learningEnabled;
    private final double learningConfidenceFloor;
    private final int learnedCacheMaxSize;
    private final int persistenceThreads;
    private final boolean synchronousPersistence;

    private EngineConfig(Builder builder) {
        this.overrideFile = builder.overrideFile;
        this.learningEnabled = builder.learningEnabled;
        this.learningConfidenceFloor = builder.learningConfidenceFloor;
        this.learnedCacheMaxSize = builder.learnedCacheMaxSize;
        this.persistenceThreads = builder.persistenceThreads;
        this.synchronousPersistence = builder.synchronousPersistence;
    }

    /**
     * Optional flat JSON file merged over the built-in manual table, or null.
     */
    public Path getOverrideFile() {
        return overrideFile;
    }

    public boolean isLearningEnabled() {
        return learningEnabled;
    }

    /**
     * Minimum confidence a non-learned result needs to be stored as a learned mapping.
     */
    public double getLearningConfidenceFloor() {
        return learningConfidenceFloor;
    }

    public int getLearnedCacheMaxSize() {
        return learnedCacheMaxSize;
    }

    public int getPersistenceThreads() {
        return persistenceThreads;
    }

    /**
     * When true, attempt and learning writes run on the calling thread.
     */
    public boolean isSynchronousPersistence() {
        return synchronousPersistence;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Reads settings from properties; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static EngineConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String overrideFile = properties.getProperty(OVERRIDE_FILE);
        if (overrideFile != null && !overrideFile.isBlank()) {
            builder.overrideFile(Path.of(overrideFile.trim()));
        }
        String value = properties.getProperty(LEARNING_ENABLED);
        if (value != null) {
            builder.learningEnabled(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(LEARNING_CONFIDENCE_FLOOR);
        if (value != null) {
            builder.learningConfidenceFloor(parseDouble(LEARNING_CONFIDENCE_FLOOR, value));
        }
        value = properties.getProperty(LEARNED_CACHE_MAX_SIZE);
        if (value != null) {
            builder.learnedCacheMaxSize(parseInt(LEARNED_CACHE_MAX_SIZE, value));
        }
        value = properties.getProperty(PERSISTENCE_THREADS);
        if (value != null) {
            builder.persistenceThreads(parseInt(PERSISTENCE_THREADS, value));
        }
        value = properties.getProperty(PERSISTENCE_SYNCHRONOUS);
        if (value != null) {
            builder.synchronousPersistence(Boolean.parseBoolean(value.trim()));
        }
        return builder.build();
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + value + "'", e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path overrideFile;
        private boolean learningEnabled = true;
        private double learningConfidenceFloor = DEFAULT_LEARNING_CONFIDENCE_FLOOR;
        private int learnedCacheMaxSize = DEFAULT_LEARNED_CACHE_MAX_SIZE;
        private int persistenceThreads = DEFAULT_PERSISTENCE_THREADS;
        private boolean synchronousPersistence = false;

        public Builder overrideFile(Path overrideFile) {
            this.overrideFile = overrideFile;
            return this;
        }

        public Builder learningEnabled(boolean learningEnabled) {
            this.learningEnabled = learningEnabled;
            return this;
        }

        public Builder learningConfidenceFloor(double floor) {
            if (floor < 0.0 || floor > 1.0) {
                throw new IllegalArgumentException("learningConfidenceFloor must be between 0.0 and 1.0");
            }
            this.learningConfidenceFloor = floor;
            return this;
        }

        public Builder learnedCacheMaxSize(int maxSize) {
            if (maxSize <= 0) {
                throw new IllegalArgumentException("learnedCacheMaxSize must be > 0");
            }
            this.learnedCacheMaxSize = maxSize;
            return this;
        }

        public Builder persistenceThreads(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("persistenceThreads must be > 0");
            }
            this.persistenceThreads = threads;
            return this;
        }

        public Builder synchronousPersistence(boolean synchronousPersistence) {
            this.synchronousPersistence = synchronousPersistence;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "overrideFile=" + overrideFile +
                ", learningEnabled=" + learningEnabled +
                ", learningConfidenceFloor=" + learningConfidenceFloor +
                ", learnedCacheMaxSize=" + learnedCacheMaxSize +
                ", persistenceThreads=" + persistenceThreads +
                ", synchronousPersistence=" + synchronousPersistence +
                '}';
    }
}
