package com.team.identity.core.model;

import java.util.Arrays;

/**
 * Tags identifying which strategy produced a {@link MatchResult} or a learned mapping.
 * The first seven constants are the resolution cascade in priority order.
 */
public enum MatchStrategy {
    EXACT_MATCH("exact_match"),
    MANUAL_MAPPING("manual_mapping"),
    LEARNED_MAPPING("learned_mapping"),
    NORMALIZED_MATCHING("normalized_matching"),
    SUBSTRING_MATCHING("substring_matching"),
    WORD_BASED_MATCHING("word_based_matching"),
    FUZZY_MATCHING("fuzzy_matching"),

    /**
     * Not a cascade strategy: marks learned mappings confirmed by an operator.
     */
    MANUAL_VERIFICATION("manual_verification");

    private final String tag;

    MatchStrategy(String tag) {
        this.tag = tag;
    }

    /**
     * The stable string tag used in persisted records and reports.
     */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a persisted tag back to its constant.
     *
     * @throws IllegalArgumentException if the tag is unknown
     */
    public static MatchStrategy fromTag(String tag) {
        return Arrays.stream(values())
                .filter(s -> s.tag.equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown strategy tag: " + tag));
    }

    @Override
    public String toString() {
        return tag;
    }
}
