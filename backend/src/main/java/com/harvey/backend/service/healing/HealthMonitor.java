package com.harvey.backend.service.healing;

import com.harvey.backend.config.HealingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic driver for {@link SelfHealingManager#runHealingCycle()}. A failing cycle
 * delays the next one by the cool-down instead of stopping the loop.
 */
@Slf4j
@Component
public class HealthMonitor implements SmartLifecycle {

    private final SelfHealingManager manager;
    private final HealingProperties properties;

    private volatile ScheduledExecutorService executor;
    private volatile boolean running = false;

    public HealthMonitor(SelfHealingManager manager, HealingProperties properties) {
        this.manager = manager;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!properties.getMonitor().isEnabled()) {
            log.info("Health monitor disabled");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
        running = true;
        Duration interval = Duration.ofSeconds(properties.getMonitor().getIntervalSeconds());
        schedule(interval);
        log.info("🩺 Health monitor started interval={}s", interval.toSeconds());
    }

    @Override
    public synchronized void stop() {
        running = false;
        ScheduledExecutorService current = executor;
        executor = null;
        if (current == null) {
            return;
        }
        current.shutdownNow();
        try {
            if (!current.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Health monitor did not stop within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Health monitor stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Runs one cycle and returns the delay before the next one.
     */
    Duration runCycle() {
        try {
            int attempts = manager.runHealingCycle();
            if (attempts > 0) {
                log.info("Health cycle attempted recoveries={}", attempts);
            }
            return Duration.ofSeconds(properties.getMonitor().getIntervalSeconds());
        } catch (Throwable t) {
            log.error("Health monitor cycle failed, cooling down {}s",
                    properties.getMonitor().getCooldownSeconds(), t);
            return Duration.ofSeconds(properties.getMonitor().getCooldownSeconds());
        }
    }

    private void schedule(Duration delay) {
        ScheduledExecutorService current = executor;
        if (!running || current == null) {
            return;
        }
        try {
            current.schedule(() -> schedule(runCycle()), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Health monitor executor shut down, not rescheduling");
        }
    }
}
