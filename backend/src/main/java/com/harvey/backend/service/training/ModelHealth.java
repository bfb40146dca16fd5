package com.harvey.backend.service.training;

public enum ModelHealth {
    GOOD,
    AGING,
    STALE,
    MISSING;

    static ModelHealth forAge(double ageDays) {
        if (ageDays <= 7) {
            return GOOD;
        }
        return ageDays <= 30 ? AGING : STALE;
    }
}
