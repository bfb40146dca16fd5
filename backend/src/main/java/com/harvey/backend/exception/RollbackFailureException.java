package com.harvey.backend.exception;

/**
 * Restoring models from a backup failed. Production artifacts may be inconsistent and
 * need a manual fix.
 */
public class RollbackFailureException extends RuntimeException {
    public RollbackFailureException(String message) {
        super(message);
    }

    public RollbackFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
