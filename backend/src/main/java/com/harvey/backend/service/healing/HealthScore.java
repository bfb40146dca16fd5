package com.harvey.backend.service.healing;

/**
 * Bounded reputation of a service, kept in hundredths so repeated deltas stay exact.
 */
public class HealthScore {

    private static final int MAX_POINTS = 100;
    private static final int SUCCESS_DELTA = 10;
    private static final int FAILURE_DELTA = 20;

    private int points = MAX_POINTS;

    public synchronized void onSuccess() {
        points = Math.min(MAX_POINTS, points + SUCCESS_DELTA);
    }

    public synchronized void onFailure() {
        points = Math.max(0, points - FAILURE_DELTA);
    }

    public synchronized double value() {
        return points / 100.0;
    }
}
