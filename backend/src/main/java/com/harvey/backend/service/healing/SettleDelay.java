package com.harvey.backend.service.healing;

import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class SettleDelay {

    /**
     * Returns false when the wait was interrupted; the interrupt flag is restored.
     */
    public boolean await(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
