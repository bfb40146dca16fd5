package com.harvey.backend.service.healing;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class RecoveryStrategyRegistry {

    private final Map<String, RecoveryStrategy> strategies = new LinkedHashMap<>();

    public RecoveryStrategyRegistry(Collection<? extends RecoveryStrategy> strategies) {
        for (RecoveryStrategy strategy : strategies) {
            RecoveryStrategy previous = this.strategies.put(strategy.serviceName(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate recovery strategy for " + strategy.serviceName());
            }
        }
    }

    public Optional<RecoveryStrategy> find(String serviceName) {
        return Optional.ofNullable(strategies.get(serviceName));
    }
}
