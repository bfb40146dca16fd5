package com.harvey.backend.service.training;

public enum ModelOutcome {
    SUCCESS,
    SKIPPED,
    FAILED,
    /** Counted as a failure. */
    TIMEOUT;

    public boolean countsAsSuccess() {
        return this == SUCCESS || this == SKIPPED;
    }
}
