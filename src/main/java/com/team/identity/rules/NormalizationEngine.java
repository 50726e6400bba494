package com.team.identity.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes team names into comparison keys.
 * Rules run in the order they were given; the table is never re-sorted because
 * later rules may depend on text shaped by earlier ones.
 *
 * <p>The result is idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Gets all rules in application order.
     */
    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes a team name: strip, apply every rule in order, collapse whitespace (any Unicode space), lowercase.
     * Never fails; null and blank input yield an empty string.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name.strip();

        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isDebugEnabled() && !before.equals(result)) {
                log.debug("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }

        return WHITESPACE.matcher(result).replaceAll(" ")
                .strip()
                .toLowerCase(Locale.ROOT);
    }

    /**
     * Checks if two names share the same normalized key.
     */
    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }
}
