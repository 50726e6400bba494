package com.team.identity.graph;

/**
 * Shape checks applied to names before they reach the cascade or the store.
 */
public final class InputSanitizer {

    /** Maximum allowed length for a team name. */
    public static final int MAX_TEAM_NAME_LENGTH = 200;

    /** Maximum allowed length for a context value. */
    public static final int MAX_CONTEXT_LENGTH = 200;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a team name submitted for resolution or verification.
     *
     * @param name the team name to validate
     * @throws IllegalArgumentException if the name is null, blank, too long or contains control characters
     */
    public static void validateTeamName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Team name must not be null or blank");
        }
        if (name.length() > MAX_TEAM_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "Team name exceeds maximum length of " + MAX_TEAM_NAME_LENGTH +
                            " characters (was " + name.length() + ")");
        }
        if (containsControlCharacters(name)) {
            throw new IllegalArgumentException("Team name must not contain control characters");
        }
    }

    /**
     * Validates an optional context value. Null is allowed.
     *
     * @throws IllegalArgumentException if the context is too long or contains control characters
     */
    public static void validateContext(String context) {
        if (context == null) {
            return;
        }
        if (context.length() > MAX_CONTEXT_LENGTH) {
            throw new IllegalArgumentException(
                    "Context exceeds maximum length of " + MAX_CONTEXT_LENGTH +
                            " characters (was " + context.length() + ")");
        }
        if (containsControlCharacters(context)) {
            throw new IllegalArgumentException("Context must not contain control characters");
        }
    }

    /**
     * Checks for ASCII control characters (0x00-0x1F, 0x7F). Tabs and line breaks count too:
     * provider team names never legitimately carry them.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
