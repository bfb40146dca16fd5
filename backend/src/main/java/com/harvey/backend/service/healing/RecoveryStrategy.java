package com.harvey.backend.service.healing;

public interface RecoveryStrategy {

    String serviceName();

    /**
     * Tries to bring the service back. Returns false rather than throwing on any failure.
     */
    boolean recover();
}
