package com.team.identity.graph;

/**
 * Runtime exception thrown when the learned mapping store or the attempt log
 * cannot be reached or a write is rejected.
 */
public class PersistenceUnavailableException extends RuntimeException {

    public PersistenceUnavailableException(String message) {
        super(message);
    }

    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
