package com.harvey.backend.service.healing;

public interface HealthProbe {

    /**
     * True only for a success status received within the probe timeout.
     */
    boolean isHealthy(String url);
}
