package com.harvey.backend.config;

import com.harvey.backend.service.healing.HealthProbe;
import com.harvey.backend.service.healing.RecoveryStrategy;
import com.harvey.backend.service.healing.RecoveryStrategyRegistry;
import com.harvey.backend.service.healing.RemoteControl;
import com.harvey.backend.service.healing.RemoteControlRecoveryStrategy;
import com.harvey.backend.service.healing.SettleDelay;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Configuration
public class HealingConfig {

    /**
     * Strategies declared as beans win over the remote-control default for the same service.
     */
    @Bean
    public RecoveryStrategyRegistry recoveryStrategyRegistry(HealingProperties properties,
                                                             RemoteControl remoteControl,
                                                             HealthProbe healthProbe,
                                                             SettleDelay settleDelay,
                                                             ObjectProvider<RecoveryStrategy> customStrategies) {
        List<RecoveryStrategy> strategies = new ArrayList<>(customStrategies.orderedStream().toList());
        Set<String> covered = strategies.stream()
                .map(RecoveryStrategy::serviceName)
                .collect(Collectors.toSet());
        for (HealingProperties.Service service : properties.getServices()) {
            if (covered.contains(service.getName()) || service.getTarget() == null || service.getTarget().isBlank()) {
                continue;
            }
            strategies.add(new RemoteControlRecoveryStrategy(service, remoteControl, healthProbe, settleDelay));
        }
        return new RecoveryStrategyRegistry(strategies);
    }
}
