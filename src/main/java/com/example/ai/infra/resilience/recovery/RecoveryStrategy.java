package com.example.ai.infra.resilience.recovery;

/**
 * How {@link RecoveryCoordinator#recoverService(String)} validates a service.
 */
public enum RecoveryStrategy {
    /** Reset the breaker, then trust the health check. */
    IMMEDIATE,
    /** Let an open breaker run its timeout; judge half-open trials; otherwise gate on the health check. */
    GRADUAL,
    /** {@link #GRADUAL}, attempted only after dependency health is reconfirmed. */
    COORDINATED,
    /** Never recovered automatically. */
    MANUAL
}
