package com.harvey.backend.service.healing;

import com.harvey.backend.config.HealingProperties;
import com.harvey.backend.dto.HealthReport;
import com.harvey.backend.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SelfHealingManagerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final ServiceLocks serviceLocks = new ServiceLocks();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private RecoveryStrategy mlApiStrategy;
    private RecoveryStrategy trainingStrategy;
    private HealingProperties properties;
    private SelfHealingManager manager;

    @BeforeEach
    void setUp() {
        mlApiStrategy = strategy("ml_api");
        trainingStrategy = strategy("ml_training");
        properties = new HealingProperties();
        properties.setLockWaitSeconds(0);
        properties.setServices(List.of(
                service("ml_api", 5, 60),
                service("ml_training", 2, 120)));
        manager = new SelfHealingManager(properties,
                new RecoveryStrategyRegistry(List.of(mlApiStrategy, trainingStrategy)),
                serviceLocks, clock, meterRegistry);
    }

    @Test
    void unknownServicesFailOpen() {
        assertThat(manager.checkCircuit("video_service")).isTrue();
        assertThat(manager.attemptRecovery("video_service")).isFalse();

        manager.recordFailure("video_service", "connection refused");
        manager.recordSuccess("video_service");

        assertThat(manager.getRecoveryHistory())
                .extracting(RecoveryEvent::service, RecoveryEvent::action)
                .containsExactly(tuple("video_service", RecoveryEvent.Action.FAILURE_RECORDED));
        assertThat(manager.getHealthReport().getServices()).doesNotContainKey("video_service");
    }

    @Test
    void recoveryAttemptedOnlyOnceScoreDropsBelowHalf() {
        when(mlApiStrategy.recover()).thenReturn(true);

        manager.recordFailure("ml_api", "timeout");
        manager.recordFailure("ml_api", "timeout");
        assertThat(manager.healthScore("ml_api")).isEqualTo(0.6);
        assertThat(manager.runHealingCycle()).isZero();
        verify(mlApiStrategy, never()).recover();

        manager.recordFailure("ml_api", "timeout");
        assertThat(manager.healthScore("ml_api")).isEqualTo(0.4);
        assertThat(manager.runHealingCycle()).isEqualTo(1);
        verify(mlApiStrategy, times(1)).recover();

        assertThat(manager.healthScore("ml_api")).isEqualTo(0.5);
        assertThat(manager.getHealthReport().getServices().get("ml_api").getFailureCount()).isZero();
        assertThat(manager.getRecoveryHistory()).last()
                .extracting(RecoveryEvent::action)
                .isEqualTo(RecoveryEvent.Action.RECOVERY_SUCCESS);
    }

    @Test
    void openCircuitSuppressesRecovery() {
        manager.recordFailure("ml_training", "exit 1");
        manager.recordFailure("ml_training", "exit 1");
        manager.recordFailure("ml_training", "exit 1");

        assertThat(manager.healthScore("ml_training")).isEqualTo(0.4);
        assertThat(manager.checkCircuit("ml_training")).isFalse();
        assertThat(manager.runHealingCycle()).isZero();
        verify(trainingStrategy, never()).recover();

        clock.advance(Duration.ofSeconds(121));
        assertThat(manager.runHealingCycle()).isEqualTo(1);
        verify(trainingStrategy).recover();
    }

    @Test
    void failedRecoveryIsRecorded() {
        when(mlApiStrategy.recover()).thenReturn(false);

        assertThat(manager.attemptRecovery("ml_api")).isFalse();

        RecoveryEvent event = manager.getRecoveryHistory().get(0);
        assertThat(event.action()).isEqualTo(RecoveryEvent.Action.RECOVERY_FAILED);
        assertThat(event.timestamp()).isEqualTo(clock.instant());
    }

    @Test
    void strategyExceptionsAreContained() {
        when(mlApiStrategy.recover()).thenThrow(new IllegalStateException("ssh: no route to host"));

        assertThat(manager.attemptRecovery("ml_api")).isFalse();

        RecoveryEvent event = manager.getRecoveryHistory().get(0);
        assertThat(event.action()).isEqualTo(RecoveryEvent.Action.RECOVERY_FAILED);
        assertThat(event.error()).isEqualTo("ssh: no route to host");
    }

    @Test
    void historyKeepsNewestHundredEvents() {
        for (int i = 0; i < 150; i++) {
            manager.recordFailure("ml_api", "failure " + i);
        }

        List<RecoveryEvent> history = manager.getRecoveryHistory();
        assertThat(history).hasSize(100);
        assertThat(history.get(0).error()).isEqualTo("failure 50");
        assertThat(history.get(99).error()).isEqualTo("failure 149");
    }

    @Test
    void reportShowsLastTenRecoveriesAndMeanHealth() {
        when(mlApiStrategy.recover()).thenReturn(true);
        for (int i = 0; i < 15; i++) {
            manager.attemptRecovery("ml_api");
        }
        manager.recordFailure("ml_training", "exit 2");
        manager.recordFailure("ml_training", "exit 2");

        HealthReport report = manager.getHealthReport();

        assertThat(report.getRecentRecoveries()).hasSize(10)
                .allMatch(RecoveryEvent::isRecovery);
        assertThat(report.getOverallHealth()).isEqualTo((1.0 + 0.6) / 2);
        assertThat(report.getServices().get("ml_training").getCircuitState())
                .isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(report.getServices().get("ml_training").isAvailable()).isFalse();
        assertThat(report.getTimestamp()).isEqualTo(clock.instant());
    }

    @Test
    void reportDoesNotChangeBreakerState() {
        manager.recordFailure("ml_training", "exit 2");
        manager.recordFailure("ml_training", "exit 2");
        clock.advance(Duration.ofSeconds(200));

        assertThat(manager.getHealthReport().getServices().get("ml_training").isAvailable()).isTrue();
        assertThat(manager.getHealthReport().getServices().get("ml_training").getCircuitState())
                .isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    void recoverySkippedWhileAnotherTriggerHoldsTheLock() throws Exception {
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> serviceLocks.withLock("ml_api", Duration.ofSeconds(1), () -> {
            locked.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Boolean.TRUE;
        }));
        holder.start();
        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(manager.attemptRecovery("ml_api")).isFalse();
        verify(mlApiStrategy, never()).recover();

        release.countDown();
        holder.join(5000);
    }

    @Test
    void publishesGaugesPerService() {
        manager.recordFailure("ml_api", "timeout");

        assertThat(meterRegistry.get("healing_health_score").tag("service", "ml_api").gauge().value())
                .isEqualTo(0.8);
        assertThat(meterRegistry.get("healing_circuit_state").tag("service", "ml_api").gauge().value())
                .isEqualTo(0.0);
    }

    private static RecoveryStrategy strategy(String name) {
        RecoveryStrategy strategy = mock(RecoveryStrategy.class);
        when(strategy.serviceName()).thenReturn(name);
        return strategy;
    }

    private static HealingProperties.Service service(String name, int threshold, long timeoutSeconds) {
        HealingProperties.Service service = new HealingProperties.Service();
        service.setName(name);
        service.setFailureThreshold(threshold);
        service.setTimeoutSeconds(timeoutSeconds);
        service.setTarget(name);
        return service;
    }
}
