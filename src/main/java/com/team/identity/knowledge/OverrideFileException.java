package com.team.identity.knowledge;

/**
 * Thrown when the manual mapping override file is missing, unreadable or not a flat JSON object.
 */
public class OverrideFileException extends RuntimeException {

    public OverrideFileException(String message) {
        super(message);
    }

    public OverrideFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
