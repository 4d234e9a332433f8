package com.example.ai.infra.resilience.recovery;

/**
 * Fire-and-forget observer of recovery events. Exceptions are logged and dropped by the coordinator.
 */
@FunctionalInterface
public interface RecoveryEventListener {

    void onEvent(RecoveryEvent event);
}
