package com.team.identity.review;

import com.team.identity.graph.InputSanitizer;
import com.team.identity.knowledge.KnowledgeBase;
import com.team.identity.logging.LogContext;
import com.team.identity.metrics.MetricsService;
import com.team.identity.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies operator accept/reject decisions to the learned mapping store.
 *
 * <p>An acceptance stores the pair as a verified mapping at full confidence; a rejection
 * deletes the pair in every context. Rejection is not a blocklist: other strategies may
 * still suggest the same pair later.</p>
 */
public class VerificationService {
    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private final KnowledgeBase knowledgeBase;
    private final MetricsService metricsService;

    public VerificationService(KnowledgeBase knowledgeBase) {
        this(knowledgeBase, new NoOpMetricsService());
    }

    public VerificationService(KnowledgeBase knowledgeBase, MetricsService metricsService) {
        this.knowledgeBase = knowledgeBase;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Records an operator decision on a prior resolution. Runs synchronously, so the
     * next resolution in this process sees the change.
     *
     * @return true if the decision was stored, false if the store was unavailable
     * @throws IllegalArgumentException if either name or the context is malformed
     */
    public boolean verify(String sourceName, String matchedName, boolean accepted, String context) {
        InputSanitizer.validateTeamName(sourceName);
        InputSanitizer.validateTeamName(matchedName);
        InputSanitizer.validateContext(context);

        try (LogContext ignored = LogContext.forVerification(sourceName, matchedName, accepted)) {
            try {
                knowledgeBase.verify(sourceName, matchedName, accepted, context);
            } catch (RuntimeException e) {
                log.error("Failed to store verification of '{}' -> '{}'", sourceName, matchedName, e);
                metricsService.incrementPersistenceFailure("verify");
                return false;
            }
            metricsService.incrementVerification(accepted);
            log.info("mapping.{} source='{}' matched='{}' context='{}'",
                    accepted ? "verified" : "rejected", sourceName, matchedName, context);
            return true;
        }
    }
}
