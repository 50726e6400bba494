package com.team.identity.strategy;

import com.team.identity.core.model.MatchResult;
import com.team.identity.core.model.MatchStrategy;

import java.util.List;

/**
 * One step of the resolution cascade: a pure function of the source name and the
 * candidate list, plus the confidence its result must reach to end the cascade.
 */
public interface MatchingStrategy {

    /**
     * The tag stamped on every result this strategy produces.
     */
    MatchStrategy tag();

    /**
     * Minimum confidence at which the orchestrator accepts this strategy's result.
     */
    double threshold();

    /**
     * Attempts to match the source name against the candidates.
     *
     * @param sourceName the provider name being resolved, never null
     * @param candidates candidate names in caller order, without null entries
     * @return the result, {@link MatchResult#noMatch} when no candidate qualifies
     */
    MatchResult attempt(String sourceName, List<String> candidates);
}
