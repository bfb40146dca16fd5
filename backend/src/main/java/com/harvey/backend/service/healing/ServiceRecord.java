package com.harvey.backend.service.healing;

/**
 * A tracked dependency. The strategy is null when no way to recover it is configured.
 */
public record ServiceRecord(String name, CircuitBreaker breaker, HealthScore healthScore,
                            RecoveryStrategy strategy) {}
