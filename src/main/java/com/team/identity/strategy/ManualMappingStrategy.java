package com.team.identity.strategy;

import com.team.identity.core.model.MatchResult;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.knowledge.KnowledgeBase;

import java.util.List;
import java.util.Optional;

/**
 * Curated mapping of the raw provider name, accepted only when the mapped name is offered.
 */
public class ManualMappingStrategy implements MatchingStrategy {

    public static final double CONFIDENCE = 0.95;

    private final KnowledgeBase knowledgeBase;

    public ManualMappingStrategy(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    @Override
    public MatchStrategy tag() {
        return MatchStrategy.MANUAL_MAPPING;
    }

    @Override
    public double threshold() {
        return 0.95;
    }

    @Override
    public MatchResult attempt(String sourceName, List<String> candidates) {
        Optional<String> mapped = knowledgeBase.lookupManual(sourceName);
        if (mapped.isPresent() && candidates.contains(mapped.get())) {
            return MatchResult.matched(sourceName, mapped.get(), CONFIDENCE, tag(), List.of());
        }
        return MatchResult.noMatch(sourceName, tag());
    }
}
