package com.harvey.backend.service.training;

public enum RunStatus {
    HEALTHY,
    NEEDS_ATTENTION,
    ROLLED_BACK,
    ROLLBACK_FAILED,
    PREREQUISITES_FAILED;

    public boolean isHealthy() {
        return this == HEALTHY;
    }
}
