package com.team.identity.strategy;

import com.team.identity.core.model.MatchResult;
import com.team.identity.core.model.MatchStrategy;
import com.team.identity.knowledge.KnowledgeBase;

import java.util.List;
import java.util.Optional;

/**
 * Previously learned or verified mapping, accepted only when the learned name is offered.
 */
public class LearnedMappingStrategy implements MatchingStrategy {

    public static final double CONFIDENCE = 0.90;

    private final KnowledgeBase knowledgeBase;

    public LearnedMappingStrategy(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    @Override
    public MatchStrategy tag() {
        return MatchStrategy.LEARNED_MAPPING;
    }

    @Override
    public double threshold() {
        return 0.90;
    }

    @Override
    public MatchResult attempt(String sourceName, List<String> candidates) {
        Optional<String> learned = knowledgeBase.lookupLearned(sourceName);
        if (learned.isPresent() && candidates.contains(learned.get())) {
            return MatchResult.matched(sourceName, learned.get(), CONFIDENCE, tag(), List.of());
        }
        return MatchResult.noMatch(sourceName, tag());
    }
}
