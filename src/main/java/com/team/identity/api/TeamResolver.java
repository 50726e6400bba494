package com.team.identity.api;

import com.team.identity.attempt.AttemptLogRepository;
import com.team.identity.attempt.GraphAttemptLogRepository;
import com.team.identity.attempt.InMemoryAttemptLogRepository;
import com.team.identity.core.model.ManualMapping;
import com.team.identity.core.model.MatchResult;
import com.team.identity.graph.FalkorDBConnection;
import com.team.identity.graph.GraphConnection;
import com.team.identity.knowledge.GraphLearnedMappingRepository;
import com.team.identity.knowledge.InMemoryLearnedMappingRepository;
import com.team.identity.knowledge.KnowledgeBase;
import com.team.identity.knowledge.LearnedMappingRepository;
import com.team.identity.metrics.MetricsService;
import com.team.identity.metrics.NoOpMetricsService;
import com.team.identity.report.MappingReport;
import com.team.identity.report.MappingReportService;
import com.team.identity.review.VerificationService;
import com.team.identity.rules.NormalizationEngine;
import com.team.identity.rules.TeamNameNormalizationRules;
import com.team.identity.strategy.StrategyCascade;
import com.team.identity.tracing.NoOpTracingService;
import com.team.identity.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Main entry point of the team identity resolution engine.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (TeamResolver resolver = TeamResolver.builder()
 *         .falkorDB("localhost", 6379, "team-identity")
 *         .build()) {
 *
 *     MatchResult result = resolver.resolve("Manchester United",
 *             List.of("Manchester Utd", "Manchester City", "Liverpool"), "Premier League");
 *
 *     resolver.verify("Manchester United", "Manchester Utd", true, "Premier League");
 *     MappingReport weekly = resolver.report(7);
 * }
 * </pre>
 *
 * <p>Without a graph connection, learned mappings and attempts are held in memory.</p>
 */
public class TeamResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TeamResolver.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final EngineConfig config;
    private final KnowledgeBase knowledgeBase;
    private final ResolutionOrchestrator orchestrator;
    private final VerificationService verificationService;
    private final MappingReportService reportService;
    private final ExecutorService persistenceExecutor;
    private final GraphConnection connection;
    private final boolean ownsConnection;

    private TeamResolver(Builder builder) {
        this.config = builder.config;
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;

        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        NormalizationEngine normalizer = builder.normalizationEngine != null
                ? builder.normalizationEngine : TeamNameNormalizationRules.createTeamEngine();

        LearnedMappingRepository learnedRepository;
        AttemptLogRepository attemptLog;
        if (builder.learnedMappingRepository != null) {
            learnedRepository = builder.learnedMappingRepository;
        } else if (connection != null) {
            learnedRepository = new GraphLearnedMappingRepository(connection);
        } else {
            learnedRepository = new InMemoryLearnedMappingRepository();
        }
        if (builder.attemptLogRepository != null) {
            attemptLog = builder.attemptLogRepository;
        } else if (connection != null) {
            attemptLog = new GraphAttemptLogRepository(connection);
        } else {
            attemptLog = new InMemoryAttemptLogRepository();
        }

        KnowledgeBase.Builder knowledgeBuilder = KnowledgeBase.builder()
                .repository(learnedRepository)
                .overrideFile(config.getOverrideFile())
                .learnedCacheMaxSize(config.getLearnedCacheMaxSize())
                .metricsService(metricsService);
        if (builder.builtInMappings != null) {
            knowledgeBuilder.builtInMappings(builder.builtInMappings);
        }
        this.knowledgeBase = knowledgeBuilder.build();

        Executor executor;
        if (config.isSynchronousPersistence()) {
            this.persistenceExecutor = null;
            executor = Runnable::run;
        } else {
            this.persistenceExecutor = Executors.newFixedThreadPool(
                    config.getPersistenceThreads(), new PersistenceThreadFactory());
            executor = persistenceExecutor;
        }

        this.orchestrator = new ResolutionOrchestrator(
                StrategyCascade.standard(knowledgeBase, normalizer),
                knowledgeBase, attemptLog, config, executor,
                metricsService, tracingService, builder.clock);
        this.verificationService = new VerificationService(knowledgeBase, metricsService);
        this.reportService = new MappingReportService(attemptLog, knowledgeBase, metricsService, builder.clock);

        log.info("TeamResolver initialized: {}, store={}", config,
                connection != null ? connection.getGraphName() : "in-memory");
    }

    // ========== Resolution API ==========

    /**
     * Resolves a provider team name against the candidate names, without context.
     */
    public MatchResult resolve(String sourceName, List<String> candidateNames) {
        return orchestrator.resolve(sourceName, candidateNames, null);
    }

    /**
     * Resolves a provider team name against the candidate names within a context
     * such as a competition.
     *
     * @throws IllegalArgumentException if the source name or context is malformed
     */
    public MatchResult resolve(String sourceName, List<String> candidateNames, String context) {
        return orchestrator.resolve(sourceName, candidateNames, context);
    }

    // ========== Verification API ==========

    public boolean verify(String sourceName, String matchedName, boolean accepted) {
        return verificationService.verify(sourceName, matchedName, accepted, null);
    }

    /**
     * Confirms or rejects a prior resolution. Store failures are logged and reported
     * through the return value, never thrown.
     *
     * @return true if the decision was stored
     */
    public boolean verify(String sourceName, String matchedName, boolean accepted, String context) {
        return verificationService.verify(sourceName, matchedName, accepted, context);
    }

    // ========== Reporting API ==========

    /**
     * Aggregates the attempt log over the last {@code windowDays} days.
     * Returns a zero-valued report if the log cannot be read or the window is negative.
     */
    public MappingReport report(int windowDays) {
        return reportService.report(windowDays);
    }

    // ========== Knowledge base maintenance ==========

    public void reloadManualMappings() {
        knowledgeBase.reloadManualMappings();
    }

    public void refreshLearnedMappings() {
        knowledgeBase.refresh();
    }

    public KnowledgeBase getKnowledgeBase() {
        return knowledgeBase;
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * Waits for queued attempt and learning writes, then releases the owned connection.
     */
    @Override
    public void close() {
        if (persistenceExecutor != null) {
            persistenceExecutor.shutdown();
            try {
                if (!persistenceExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    List<Runnable> dropped = persistenceExecutor.shutdownNow();
                    log.warn("Persistence executor did not drain in {}s; dropped {} pending writes",
                            SHUTDOWN_TIMEOUT_SECONDS, dropped.size());
                }
            } catch (InterruptedException e) {
                persistenceExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (ownsConnection && connection != null) {
            connection.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final class PersistenceThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "team-identity-persistence-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static class Builder {
        private EngineConfig config = EngineConfig.defaults();
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private LearnedMappingRepository learnedMappingRepository;
        private AttemptLogRepository attemptLogRepository;
        private NormalizationEngine normalizationEngine;
        private Supplier<List<ManualMapping>> builtInMappings;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock = Clock.systemUTC();

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Stores learned mappings and attempts in the given graph. The caller keeps
         * ownership of the connection.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Opens a FalkorDB connection owned, and closed, by the resolver.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        public Builder learnedMappingRepository(LearnedMappingRepository repository) {
            this.learnedMappingRepository = repository;
            return this;
        }

        public Builder attemptLogRepository(AttemptLogRepository repository) {
            this.attemptLogRepository = repository;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine engine) {
            this.normalizationEngine = engine;
            return this;
        }

        /**
         * Replaces the classpath manual table, e.g. with an empty list.
         */
        public Builder builtInMappings(Supplier<List<ManualMapping>> builtInMappings) {
            this.builtInMappings = builtInMappings;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TeamResolver build() {
            if (config == null) {
                throw new IllegalStateException("EngineConfig is required");
            }
            if (clock == null) {
                clock = Clock.systemUTC();
            }
            return new TeamResolver(this);
        }
    }
}
