package com.harvey.backend.service.healing;

/**
 * Opaque control channel to the hosts running the dependent services.
 */
public interface RemoteControl {

    RemoteControlResult execute(String target, String action);

    record RemoteControlResult(boolean ok, String stdout, String stderr) {
        public static RemoteControlResult failed(String stderr) {
            return new RemoteControlResult(false, "", stderr);
        }
    }
}
