package com.team.identity.strategy;

import com.team.identity.knowledge.KnowledgeBase;
import com.team.identity.rules.NormalizationEngine;

import java.util.Iterator;
import java.util.List;

/**
 * The ordered list of strategies the orchestrator walks. Order is priority:
 * an earlier strategy that clears its threshold ends the walk.
 */
public final class StrategyCascade implements Iterable<MatchingStrategy> {

    private final List<MatchingStrategy> strategies;

    public StrategyCascade(List<MatchingStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("A cascade needs at least one strategy");
        }
        this.strategies = List.copyOf(strategies);
    }

    /**
     * The seven-step team cascade: exact, manual, learned, normalized, substring,
     * word overlap, fuzzy.
     */
    public static StrategyCascade standard(KnowledgeBase knowledgeBase, NormalizationEngine normalizer) {
        return new StrategyCascade(List.of(
                new ExactMatchStrategy(),
                new ManualMappingStrategy(knowledgeBase),
                new LearnedMappingStrategy(knowledgeBase),
                new NormalizedMatchStrategy(normalizer),
                new SubstringMatchStrategy(normalizer),
                new WordOverlapMatchStrategy(normalizer),
                new FuzzyMatchStrategy(normalizer)
        ));
    }

    public List<MatchingStrategy> strategies() {
        return strategies;
    }

    /**
     * The strategy whose result is returned when none clears its threshold.
     */
    public MatchingStrategy fallback() {
        return strategies.get(strategies.size() - 1);
    }

    @Override
    public Iterator<MatchingStrategy> iterator() {
        return strategies.iterator();
    }
}
