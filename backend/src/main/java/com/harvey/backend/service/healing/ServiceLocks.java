package com.harvey.backend.service.healing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per dependent service. Recoveries and pipeline promotions for the
 * same service never overlap.
 */
@Slf4j
@Component
public class ServiceLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Runs the action while holding the service lock. Empty when the lock could not be
     * taken within the wait.
     */
    public <T> Optional<T> withLock(String service, Duration wait, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(service, key -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for lock service={}", service);
            return Optional.empty();
        }
        if (!acquired) {
            log.warn("Lock busy service={} waited={}s", service, wait.toSeconds());
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(action.get());
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String service) {
        ReentrantLock lock = locks.get(service);
        return lock != null && lock.isLocked();
    }
}
