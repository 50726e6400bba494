package com.team.identity.api;

import com.team.identity.attempt.AttemptLogRepository;
import com.team.identity.attempt.AttemptRecord;
import com.team.identity.core.model.LearnedMapping;
import com.team.identity.core.model.MatchResult;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.graph.InputSanitizer;
import com.team.identity.knowledge.KnowledgeBase;
import com.team.identity.logging.LogContext;
import com.team.identity.metrics.MetricsService;
import com.team.identity.strategy.MatchingStrategy;
import com.team.identity.strategy.StrategyCascade;
import com.team.identity.tracing.Span;
import com.team.identity.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Walks the strategy cascade for one source name and records the outcome.
 *
 * <p>The first strategy whose result is found and reaches its own threshold ends the walk.
 * When none does, the last strategy's result is returned as it stands. Exactly one
 * {@link AttemptRecord} is written per call, and qualifying results are promoted to learned
 * mappings. A promoted mapping is served by the next call before this one returns; the
 * store writes go through the persistence executor and never fail the call.</p>
 */
public class ResolutionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ResolutionOrchestrator.class);

    private final StrategyCascade cascade;
    private final KnowledgeBase knowledgeBase;
    private final AttemptLogRepository attemptLog;
    private final EngineConfig config;
    private final Executor persistenceExecutor;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;

    public ResolutionOrchestrator(StrategyCascade cascade,
                                  KnowledgeBase knowledgeBase,
                                  AttemptLogRepository attemptLog,
                                  EngineConfig config,
                                  Executor persistenceExecutor,
                                  MetricsService metricsService,
                                  TracingService tracingService,
                                  Clock clock) {
        this.cascade = Objects.requireNonNull(cascade, "cascade is required");
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase is required");
        this.attemptLog = Objects.requireNonNull(attemptLog, "attemptLog is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.persistenceExecutor = Objects.requireNonNull(persistenceExecutor, "persistenceExecutor is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Resolves a provider team name against the candidate names.
     *
     * @param sourceName the name to resolve
     * @param candidates candidate names; null means none, null entries are ignored
     * @param context    optional scope such as a competition name, may be null
     * @throws IllegalArgumentException if the source name or context is malformed
     */
    public MatchResult resolve(String sourceName, List<String> candidates, String context) {
        InputSanitizer.validateTeamName(sourceName);
        InputSanitizer.validateContext(context);
        List<String> offered = candidates == null ? List.of()
                : candidates.stream().filter(Objects::nonNull).toList();

        long startNanos = System.nanoTime();
        String correlationId = LogContext.generateCorrelationId();

        try (LogContext ignored = LogContext.forResolution(correlationId, sourceName, context);
             Span span = tracingService.startSpan("team.resolve", Map.of(
                     "team.source", sourceName,
                     "team.context", context != null ? context : ""))) {

            log.debug("Resolving '{}' against {} candidates", sourceName, offered.size());
            MatchResult result;
            try {
                result = runCascade(sourceName, offered)
                        .withElapsedTime(Duration.ofNanos(System.nanoTime() - startNanos));
            } catch (RuntimeException e) {
                span.markFailed(e);
                throw e;
            }

            span.setAttribute("team.strategy", result.strategyUsed().tag());
            span.setAttribute("team.confidence", result.confidence());
            span.setAttribute("team.matched", result.matchFound());

            metricsService.recordResolution(result.strategyUsed(), result.matchFound(), result.elapsedTime());
            metricsService.recordConfidence(result.confidence());

            log.info("team.resolved source='{}' matched='{}' strategy={} confidence={} found={}",
                    sourceName, result.matchedName(), result.strategyUsed(),
                    result.confidence(), result.matchFound());

            LearnedMapping staged = shouldLearn(result) ? stage(result, context) : null;
            persist(result, context, clock.instant(), staged);
            return result;
        }
    }

    private MatchResult runCascade(String sourceName, List<String> candidates) {
        MatchResult last = null;
        for (MatchingStrategy strategy : cascade) {
            last = strategy.attempt(sourceName, candidates);
            if (last.isAcceptedAt(strategy.threshold())) {
                return last;
            }
            log.trace("{} did not clear {} (confidence {})", strategy.tag(), strategy.threshold(), last.confidence());
        }
        return last;
    }

    private void persist(MatchResult result, String context, Instant timestamp, LearnedMapping staged) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Runnable task = () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                recordAttempt(result, context, timestamp);
                if (staged != null) {
                    learn(staged);
                }
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
        try {
            persistenceExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.error("Persistence executor rejected the attempt for '{}'", result.sourceName(), e);
            metricsService.incrementPersistenceFailure("attempt.submit");
        }
    }

    private void recordAttempt(MatchResult result, String context, Instant timestamp) {
        try {
            attemptLog.save(AttemptRecord.of(result, context, timestamp));
        } catch (RuntimeException e) {
            log.error("Failed to record mapping attempt for '{}'", result.sourceName(), e);
            metricsService.incrementPersistenceFailure("attempt.save");
        }
    }

    private LearnedMapping stage(MatchResult result, String context) {
        try {
            return knowledgeBase.stageLearned(result.sourceName(), result.matchedName(), result.confidence(),
                    result.strategyUsed(), context);
        } catch (RuntimeException e) {
            log.error("Failed to stage learned mapping '{}' -> '{}'", result.sourceName(), result.matchedName(), e);
            metricsService.incrementPersistenceFailure("learned.save");
            return null;
        }
    }

    private void learn(LearnedMapping staged) {
        try {
            knowledgeBase.persistLearned(staged);
        } catch (RuntimeException e) {
            log.error("Failed to learn mapping '{}' -> '{}'", staged.sourceName(), staged.matchedName(), e);
            metricsService.incrementPersistenceFailure("learned.save");
        }
    }

    boolean shouldLearn(MatchResult result) {
        return config.isLearningEnabled()
                && result.matchFound()
                && result.confidence() >= config.getLearningConfidenceFloor()
                && result.strategyUsed() != MatchStrategy.LEARNED_MAPPING;
    }
}
