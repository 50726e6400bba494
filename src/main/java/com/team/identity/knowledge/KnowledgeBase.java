package com.team.identity.knowledge;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.team.identity.core.model.LearnedMapping;
import com.team.identity.core.model.ManualMapping;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.graph.PersistenceUnavailableException;
import com.team.identity.metrics.MetricsService;
import com.team.identity.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Engine-owned view of the manual and learned mapping sources.
 *
 * <p>Manual lookups are exact, case-sensitive lookups on the raw provider name.
 * Learned lookups go through a Caffeine cache keyed by source name; every write
 * for a source invalidates its entry so the next lookup reloads from the store.</p>
 *
 * <p>A learned row is served when it is verified, when its confidence exceeds
 * {@value #TRUSTED_CONFIDENCE}, or when this instance wrote it during the current process.</p>
 *
 * <p>Learning is split in two: {@link #stageLearned} makes a mapping visible to lookups
 * in this process immediately, {@link #persistLearned} writes it to the store later.
 * Staged mappings stay visible until the store holds them.</p>
 */
public class KnowledgeBase {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeBase.class);

    public static final double TRUSTED_CONFIDENCE = 0.9;
    public static final double VERIFIED_CONFIDENCE = 1.0;

    private static final Comparator<LearnedMapping> MOST_TRUSTED_FIRST =
            Comparator.comparingDouble(LearnedMapping::confidence).reversed()
                    .thenComparing(LearnedMapping::verified, Comparator.reverseOrder());

    private final LearnedMappingRepository repository;
    private final Supplier<List<ManualMapping>> builtInMappings;
    private final Path overrideFile;
    private final OverrideFileLoader overrideFileLoader;
    private final MetricsService metricsService;
    private final LoadingCache<String, Optional<LearnedMapping>> learnedCache;
    private final Set<LearnedMapping.Key> sessionLearned = ConcurrentHashMap.newKeySet();
    private final Map<LearnedMapping.Key, LearnedMapping> pendingLearned = new ConcurrentHashMap<>();

    private volatile Map<String, String> manualMappings = Map.of();

    private KnowledgeBase(Builder builder) {
        this.repository = Objects.requireNonNull(builder.repository, "repository is required");
        this.builtInMappings = builder.builtInMappings;
        this.overrideFile = builder.overrideFile;
        this.overrideFileLoader = builder.overrideFileLoader;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.learnedCache = Caffeine.newBuilder()
                .maximumSize(builder.learnedCacheMaxSize)
                .build(this::loadLearned);
        reloadManualMappings();
    }

    // ========== Manual mappings ==========

    /**
     * Looks up the curated canonical name for an exact provider spelling.
     */
    public Optional<String> lookupManual(String sourceName) {
        if (sourceName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(manualMappings.get(sourceName));
    }

    /**
     * Re-reads the built-in table and the override file. Override entries replace
     * built-in entries with the same key. An unreadable override file leaves the
     * built-in table in effect.
     */
    public void reloadManualMappings() {
        Map<String, String> merged = new LinkedHashMap<>();
        for (ManualMapping mapping : builtInMappings.get()) {
            merged.put(mapping.sourceName(), mapping.canonicalName());
        }
        int builtInCount = merged.size();

        int overrideCount = 0;
        if (overrideFile != null) {
            try {
                List<ManualMapping> overrides = overrideFileLoader.load(overrideFile);
                for (ManualMapping mapping : overrides) {
                    merged.put(mapping.sourceName(), mapping.canonicalName());
                }
                overrideCount = overrides.size();
            } catch (OverrideFileException e) {
                log.warn("Ignoring manual mapping override file {}: {}", overrideFile, e.getMessage());
            }
        }

        this.manualMappings = Map.copyOf(merged);
        log.info("Loaded {} manual mappings ({} built-in, {} from override file)",
                manualMappings.size(), builtInCount, overrideCount);
    }

    public int manualMappingCount() {
        return manualMappings.size();
    }

    // ========== Learned mappings ==========

    /**
     * Gets the most trusted eligible learned target for a source name, in any context.
     * Store failures degrade to an empty result and are not cached.
     */
    public Optional<String> lookupLearned(String sourceName) {
        if (sourceName == null) {
            return Optional.empty();
        }
        try {
            return learnedCache.get(sourceName).map(LearnedMapping::matchedName);
        } catch (PersistenceUnavailableException e) {
            log.error("Learned mapping lookup failed for '{}'", sourceName, e);
            metricsService.incrementPersistenceFailure("learned.lookup");
            return pendingFor(sourceName).min(MOST_TRUSTED_FIRST).map(LearnedMapping::matchedName);
        }
    }

    /**
     * Inserts or overwrites the learned mapping keyed by (source, matched, context),
     * staging and persisting it in one step.
     *
     * @throws PersistenceUnavailableException if the store rejects the write
     */
    public LearnedMapping recordLearned(String sourceName, String matchedName, double confidence,
                                        MatchStrategy strategy, String context) {
        LearnedMapping mapping = stageLearned(sourceName, matchedName, confidence, strategy, context);
        persistLearned(mapping);
        return mapping;
    }

    /**
     * Makes a learned mapping visible to {@link #lookupLearned} in this process without
     * touching the store.
     */
    public LearnedMapping stageLearned(String sourceName, String matchedName, double confidence,
                                       MatchStrategy strategy, String context) {
        LearnedMapping mapping = LearnedMapping.builder()
                .sourceName(sourceName)
                .matchedName(matchedName)
                .confidence(confidence)
                .strategyUsed(strategy)
                .verified(false)
                .context(context)
                .build();
        pendingLearned.put(mapping.key(), mapping);
        sessionLearned.add(mapping.key());
        learnedCache.invalidate(sourceName);
        return mapping;
    }

    /**
     * Writes a staged mapping to the store. A mapping superseded by an operator decision
     * since it was staged is skipped. On failure the staged copy stays visible.
     *
     * @return true if the store was written
     * @throws PersistenceUnavailableException if the store rejects the write
     */
    public boolean persistLearned(LearnedMapping mapping) {
        if (pendingLearned.get(mapping.key()) != mapping) {
            log.debug("Skipping superseded learned mapping '{}' -> '{}'",
                    mapping.sourceName(), mapping.matchedName());
            return false;
        }
        repository.upsert(mapping);
        pendingLearned.remove(mapping.key(), mapping);
        learnedCache.invalidate(mapping.sourceName());
        metricsService.incrementLearnedMapping(mapping.strategyUsed());
        log.info("mapping.learned source='{}' matched='{}' confidence={} strategy={}",
                mapping.sourceName(), mapping.matchedName(), mapping.confidence(), mapping.strategyUsed());
        return true;
    }

    /**
     * Applies an operator decision. Acceptance stores a verified mapping at full confidence;
     * rejection deletes the pair in every context.
     *
     * @throws PersistenceUnavailableException if the store rejects the write
     */
    public void verify(String sourceName, String matchedName, boolean accepted, String context) {
        if (accepted) {
            pendingLearned.remove(new LearnedMapping.Key(sourceName, matchedName, context));
            repository.upsert(LearnedMapping.builder()
                    .sourceName(sourceName)
                    .matchedName(matchedName)
                    .confidence(VERIFIED_CONFIDENCE)
                    .strategyUsed(MatchStrategy.MANUAL_VERIFICATION)
                    .verified(true)
                    .context(context)
                    .build());
        } else {
            pendingLearned.keySet().removeIf(key ->
                    key.sourceName().equals(sourceName) && key.matchedName().equals(matchedName));
            int removed = repository.deleteBySourceAndMatched(sourceName, matchedName);
            sessionLearned.removeIf(key ->
                    key.sourceName().equals(sourceName) && key.matchedName().equals(matchedName));
            log.debug("Removed {} learned rows for '{}' -> '{}'", removed, sourceName, matchedName);
        }
        learnedCache.invalidate(sourceName);
    }

    /**
     * Drops every cached learned lookup; the next lookups reload from the store.
     */
    public void refresh() {
        learnedCache.invalidateAll();
        log.debug("Learned mapping cache invalidated");
    }

    /**
     * @throws PersistenceUnavailableException if the store cannot be read
     */
    public int learnedMappingCount() {
        return repository.count();
    }

    private Optional<LearnedMapping> loadLearned(String sourceName) {
        // pending first: persistLearned removes an entry only after the store holds it
        List<LearnedMapping> pending = pendingFor(sourceName).toList();
        return Stream.concat(
                        repository.findBySourceName(sourceName).stream().filter(this::isEligible),
                        pending.stream())
                .min(MOST_TRUSTED_FIRST);
    }

    private Stream<LearnedMapping> pendingFor(String sourceName) {
        return pendingLearned.values().stream()
                .filter(mapping -> mapping.sourceName().equals(sourceName));
    }

    private boolean isEligible(LearnedMapping mapping) {
        return mapping.verified()
                || mapping.confidence() > TRUSTED_CONFIDENCE
                || sessionLearned.contains(mapping.key());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LearnedMappingRepository repository;
        private Supplier<List<ManualMapping>> builtInMappings = ManualMappingCatalog::loadBuiltIn;
        private Path overrideFile;
        private OverrideFileLoader overrideFileLoader = new OverrideFileLoader();
        private int learnedCacheMaxSize = 10_000;
        private MetricsService metricsService;

        public Builder repository(LearnedMappingRepository repository) {
            this.repository = repository;
            return this;
        }

        /**
         * Replaces the classpath table as the source of built-in manual mappings.
         */
        public Builder builtInMappings(Supplier<List<ManualMapping>> builtInMappings) {
            this.builtInMappings = Objects.requireNonNull(builtInMappings);
            return this;
        }

        public Builder overrideFile(Path overrideFile) {
            this.overrideFile = overrideFile;
            return this;
        }

        public Builder overrideFileLoader(OverrideFileLoader overrideFileLoader) {
            this.overrideFileLoader = Objects.requireNonNull(overrideFileLoader);
            return this;
        }

        public Builder learnedCacheMaxSize(int learnedCacheMaxSize) {
            if (learnedCacheMaxSize <= 0) {
                throw new IllegalArgumentException("learnedCacheMaxSize must be > 0");
            }
            this.learnedCacheMaxSize = learnedCacheMaxSize;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public KnowledgeBase build() {
            return new KnowledgeBase(this);
        }
    }
}
