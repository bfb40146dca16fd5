package com.harvey.backend.dto;

import com.harvey.backend.service.healing.CircuitBreaker;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ServiceHealth {
    CircuitBreaker.State circuitState;
    int failureCount;
    int failureThreshold;
    Instant lastFailureTime;
    double healthScore;
    boolean available;
    boolean recoverable;
}
