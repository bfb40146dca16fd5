package com.harvey.backend.service.healing;

import java.time.Instant;

public record RecoveryEvent(String service, String error, Instant timestamp, Action action) {

    public enum Action { FAILURE_RECORDED, RECOVERY_SUCCESS, RECOVERY_FAILED }

    public boolean isRecovery() {
        return action == Action.RECOVERY_SUCCESS || action == Action.RECOVERY_FAILED;
    }
}
