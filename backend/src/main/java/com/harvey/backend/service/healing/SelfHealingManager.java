package com.harvey.backend.service.healing;

import com.harvey.backend.config.HealingProperties;
import com.harvey.backend.dto.HealthReport;
import com.harvey.backend.dto.ServiceHealth;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks a circuit breaker and a health score per dependent service and drives recovery.
 * Unknown service names are treated as available.
 */
@Slf4j
@Service
public class SelfHealingManager {

    static final int HISTORY_CAPACITY = 100;
    static final int REPORT_RECOVERIES = 10;

    private final HealingProperties properties;
    private final RecoveryStrategyRegistry strategies;
    private final ServiceLocks serviceLocks;
    private final Clock clock;
    private final Map<String, ServiceRecord> services = new LinkedHashMap<>();
    private final Deque<RecoveryEvent> history = new ArrayDeque<>(HISTORY_CAPACITY);

    public SelfHealingManager(HealingProperties properties, RecoveryStrategyRegistry strategies,
                              ServiceLocks serviceLocks, Clock clock, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.strategies = strategies;
        this.serviceLocks = serviceLocks;
        this.clock = clock;
        for (HealingProperties.Service service : properties.getServices()) {
            CircuitBreaker breaker = new CircuitBreaker(service.getFailureThreshold(),
                    Duration.ofSeconds(service.getTimeoutSeconds()), clock);
            ServiceRecord record = new ServiceRecord(service.getName(), breaker, new HealthScore(),
                    strategies.find(service.getName()).orElse(null));
            services.put(service.getName(), record);
            Gauge.builder("healing_health_score", record, r -> r.healthScore().value())
                    .tag("service", service.getName())
                    .register(meterRegistry);
            Gauge.builder("healing_circuit_state", record, r -> r.breaker().snapshot().state().ordinal())
                    .tag("service", service.getName())
                    .register(meterRegistry);
        }
        log.info("Self-healing manager tracking services={}", services.keySet());
    }

    public boolean checkCircuit(String name) {
        ServiceRecord record = services.get(name);
        return record == null || record.breaker().isAvailable();
    }

    public void recordSuccess(String name) {
        ServiceRecord record = services.get(name);
        if (record == null) {
            return;
        }
        synchronized (record) {
            record.breaker().recordSuccess();
            record.healthScore().onSuccess();
        }
    }

    public void recordFailure(String name, String error) {
        ServiceRecord record = services.get(name);
        if (record != null) {
            synchronized (record) {
                record.breaker().recordFailure();
                record.healthScore().onFailure();
            }
            log.warn("Service failure service={} score={} state={} error={}", name,
                    record.healthScore().value(), record.breaker().getState(), error);
        } else {
            log.warn("Failure reported for untracked service={} error={}", name, error);
        }
        append(name, error, RecoveryEvent.Action.FAILURE_RECORDED);
    }

    /**
     * Runs the service's recovery strategy under its service lock. Never throws.
     */
    public boolean attemptRecovery(String name) {
        ServiceRecord record = services.get(name);
        if (record == null || record.strategy() == null) {
            log.warn("No recovery strategy for service={}", name);
            return false;
        }
        Duration wait = Duration.ofSeconds(properties.getLockWaitSeconds());
        return serviceLocks.withLock(name, wait, () -> recover(record))
                .orElseGet(() -> {
                    log.warn("Skipping recovery, another restart holds the lock service={}", name);
                    return false;
                });
    }

    private Boolean recover(ServiceRecord record) {
        String name = record.name();
        try {
            if (record.strategy().recover()) {
                recordSuccess(name);
                append(name, null, RecoveryEvent.Action.RECOVERY_SUCCESS);
                log.info("✅ Recovered service={}", name);
                return true;
            }
            append(name, "recovery strategy reported failure", RecoveryEvent.Action.RECOVERY_FAILED);
            log.error("❌ Recovery failed service={}", name);
            return false;
        } catch (RuntimeException e) {
            append(name, e.getMessage(), RecoveryEvent.Action.RECOVERY_FAILED);
            log.error("❌ Recovery threw service={}", name, e);
            return false;
        }
    }

    /**
     * One pass of the monitoring loop. Returns how many recoveries were attempted.
     */
    public int runHealingCycle() {
        double threshold = properties.getMonitor().getRecoveryThreshold();
        int attempts = 0;
        for (ServiceRecord record : services.values()) {
            if (record.healthScore().value() < threshold && checkCircuit(record.name())) {
                log.info("Service degraded service={} score={}", record.name(), record.healthScore().value());
                attempts++;
                attemptRecovery(record.name());
            }
        }
        return attempts;
    }

    public HealthReport getHealthReport() {
        Map<String, ServiceHealth> report = new LinkedHashMap<>();
        double total = 0.0;
        for (ServiceRecord record : services.values()) {
            CircuitBreaker.Snapshot snapshot = record.breaker().snapshot();
            double score = record.healthScore().value();
            total += score;
            report.put(record.name(), ServiceHealth.builder()
                    .circuitState(snapshot.state())
                    .failureCount(snapshot.failureCount())
                    .failureThreshold(record.breaker().getFailureThreshold())
                    .lastFailureTime(snapshot.lastFailureTime())
                    .healthScore(score)
                    .available(snapshot.available())
                    .recoverable(record.strategy() != null)
                    .build());
        }
        List<RecoveryEvent> recoveries = new ArrayList<>();
        synchronized (history) {
            for (RecoveryEvent event : history) {
                if (event.isRecovery()) {
                    recoveries.add(event);
                }
            }
        }
        int from = Math.max(0, recoveries.size() - REPORT_RECOVERIES);
        return HealthReport.builder()
                .timestamp(clock.instant())
                .services(report)
                .overallHealth(services.isEmpty() ? 0.0 : total / services.size())
                .recentRecoveries(List.copyOf(recoveries.subList(from, recoveries.size())))
                .build();
    }

    public List<RecoveryEvent> getRecoveryHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public boolean isTracked(String name) {
        return services.containsKey(name);
    }

    public double healthScore(String name) {
        ServiceRecord record = services.get(name);
        return record == null ? 1.0 : record.healthScore().value();
    }

    private void append(String service, String error, RecoveryEvent.Action action) {
        synchronized (history) {
            if (history.size() == HISTORY_CAPACITY) {
                history.removeFirst();
            }
            history.addLast(new RecoveryEvent(service, error, clock.instant(), action));
        }
    }
}
