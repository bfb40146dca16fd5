package com.harvey.backend.service.healing;

import com.harvey.backend.config.HealingProperties;
import com.harvey.backend.service.healing.RemoteControl.RemoteControlResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RemoteControlRecoveryStrategyTest {

    private RemoteControl remoteControl;
    private HealthProbe healthProbe;
    private SettleDelay settleDelay;
    private HealingProperties.Service service;

    @BeforeEach
    void setUp() {
        remoteControl = mock(RemoteControl.class);
        healthProbe = mock(HealthProbe.class);
        settleDelay = mock(SettleDelay.class);
        when(settleDelay.await(any())).thenReturn(true);
        service = new HealingProperties.Service("ml_api", 5, 60, "harvey-ml", "restart", 10,
                "http://127.0.0.1:9000/health");
    }

    @Test
    void restartsWaitsThenProbes() {
        when(remoteControl.execute("harvey-ml", "restart")).thenReturn(new RemoteControlResult(true, "", ""));
        when(healthProbe.isHealthy("http://127.0.0.1:9000/health")).thenReturn(true);

        RemoteControlRecoveryStrategy strategy = strategy();

        assertThat(strategy.serviceName()).isEqualTo("ml_api");
        assertThat(strategy.recover()).isTrue();
        var order = inOrder(remoteControl, settleDelay, healthProbe);
        order.verify(remoteControl).execute("harvey-ml", "restart");
        order.verify(settleDelay).await(Duration.ofSeconds(10));
        order.verify(healthProbe).isHealthy("http://127.0.0.1:9000/health");
    }

    @Test
    void failedCommandSkipsProbe() {
        when(remoteControl.execute(anyString(), anyString())).thenReturn(RemoteControlResult.failed("unit not found"));

        assertThat(strategy().recover()).isFalse();
        verify(healthProbe, never()).isHealthy(anyString());
    }

    @Test
    void unhealthyProbeFailsRecovery() {
        when(remoteControl.execute(anyString(), anyString())).thenReturn(new RemoteControlResult(true, "", ""));
        when(healthProbe.isHealthy(anyString())).thenReturn(false);

        assertThat(strategy().recover()).isFalse();
    }

    @Test
    void timerServiceWithoutHealthUrlTrustsCommandResult() {
        service = new HealingProperties.Service("ml_training", 2, 120, "harvey-ml-training.timer", "restart", 0, null);
        when(remoteControl.execute("harvey-ml-training.timer", "restart")).thenReturn(new RemoteControlResult(true, "", ""));

        assertThat(strategy().recover()).isTrue();
        verify(healthProbe, never()).isHealthy(anyString());
    }

    @Test
    void exceptionsBecomeFailure() {
        when(remoteControl.execute(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

        assertThat(strategy().recover()).isFalse();
    }

    @Test
    void interruptedSettleFailsRecovery() {
        when(remoteControl.execute(anyString(), anyString())).thenReturn(new RemoteControlResult(true, "", ""));
        when(settleDelay.await(any())).thenReturn(false);

        assertThat(strategy().recover()).isFalse();
        verify(healthProbe, never()).isHealthy(anyString());
    }

    private RemoteControlRecoveryStrategy strategy() {
        return new RemoteControlRecoveryStrategy(service, remoteControl, healthProbe, settleDelay);
    }
}
