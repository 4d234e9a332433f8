package com.example.ai.infra.resilience.recovery;

import com.example.ai.infra.resilience.breaker.CircuitState;

import java.util.Set;

/**
 * Immutable snapshot of one service's recovery bookkeeping.
 *
 * @param lastAttemptMs 0 when never attempted; same for lastSuccessMs and lastFailureMs
 * @param circuitState  live breaker state, null when the service has no breaker
 * @param healthScore   adaptive breaker health, null without one
 */
public record RecoveryStatus(
        String service,
        RecoveryState state,
        int attemptCount,
        long lastAttemptMs,
        long lastSuccessMs,
        long lastFailureMs,
        Set<String> dependencies,
        boolean dependenciesHealthy,
        CircuitState circuitState,
        Integer healthScore) {
}
