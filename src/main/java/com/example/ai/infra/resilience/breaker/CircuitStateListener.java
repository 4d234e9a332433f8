package com.example.ai.infra.resilience.breaker;

/**
 * Fire-and-forget state change callback. Exceptions thrown here are logged and dropped.
 */
@FunctionalInterface
public interface CircuitStateListener {

    void onStateChange(String breakerName, CircuitState from, CircuitState to, String reason);
}
