package com.harvey.backend.service.healing;

import com.harvey.backend.config.HealingProperties;
import com.harvey.backend.service.healing.RemoteControl.RemoteControlResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Restart through the remote control, wait for the service to settle, then probe it.
 */
@Slf4j
public class RemoteControlRecoveryStrategy implements RecoveryStrategy {

    private final HealingProperties.Service service;
    private final RemoteControl remoteControl;
    private final HealthProbe healthProbe;
    private final SettleDelay settleDelay;

    public RemoteControlRecoveryStrategy(HealingProperties.Service service, RemoteControl remoteControl,
                                         HealthProbe healthProbe, SettleDelay settleDelay) {
        this.service = service;
        this.remoteControl = remoteControl;
        this.healthProbe = healthProbe;
        this.settleDelay = settleDelay;
    }

    @Override
    public String serviceName() {
        return service.getName();
    }

    @Override
    public boolean recover() {
        try {
            log.info("🔧 Recovering service={} via {} {}", service.getName(), service.getAction(), service.getTarget());
            RemoteControlResult result = remoteControl.execute(service.getTarget(), service.getAction());
            if (result == null || !result.ok()) {
                log.warn("Recovery command failed service={} stderr={}", service.getName(),
                        result == null ? "no result" : result.stderr());
                return false;
            }
            if (!settleDelay.await(Duration.ofSeconds(service.getSettleSeconds()))) {
                log.warn("Recovery interrupted while settling service={}", service.getName());
                return false;
            }
            String healthUrl = service.getHealthUrl();
            if (healthUrl == null || healthUrl.isBlank()) {
                return true;
            }
            return healthProbe.isHealthy(healthUrl);
        } catch (RuntimeException e) {
            log.error("Recovery strategy error service={}", service.getName(), e);
            return false;
        }
    }
}
