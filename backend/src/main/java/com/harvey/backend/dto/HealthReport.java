package com.harvey.backend.dto;

import com.harvey.backend.service.healing.RecoveryEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class HealthReport {
    Instant timestamp;
    Map<String, ServiceHealth> services;
    double overallHealth;
    List<RecoveryEvent> recentRecoveries;
}
