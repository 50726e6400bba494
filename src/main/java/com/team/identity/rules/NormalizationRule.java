package com.team.identity.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named regex rewrite applied to team names during normalization.
 * Patterns match case-insensitively, accented letters included.
 *
 * @param name        identifier used in debug logging
 * @param pattern     compiled match expression
 * @param replacement replacement text, may reference groups
 */
public record NormalizationRule(String name, Pattern pattern, String replacement) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    /**
     * Compiles {@code regex} with case-insensitive Unicode matching.
     */
    public static NormalizationRule of(String name, String regex, String replacement) {
        return new NormalizationRule(name,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), replacement);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return name + ": /" + pattern.pattern() + "/ -> '" + replacement + "'";
    }
}
