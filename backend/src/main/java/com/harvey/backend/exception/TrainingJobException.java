package com.harvey.backend.exception;

public class TrainingJobException extends RuntimeException {

    private final boolean timedOut;

    public TrainingJobException(String message, boolean timedOut) {
        super(message);
        this.timedOut = timedOut;
    }

    public TrainingJobException(String message, Throwable cause) {
        super(message, cause);
        this.timedOut = false;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
