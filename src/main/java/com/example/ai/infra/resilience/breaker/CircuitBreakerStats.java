package com.example.ai.infra.resilience.breaker;

/**
 * Read-only view of a breaker, safe to hand to probes and dashboards.
 *
 * @param trialSuccessRate success ratio among trials completed in the current half-open episode
 *                         (0 when none completed yet, or when not half-open)
 */
public record CircuitBreakerStats(
        String name,
        CircuitState state,
        double failureRate,
        int totalRequests,
        int failures,
        int successes,
        long openedAtMs,
        long stateSinceMs,
        int halfOpenAdmitted,
        int halfOpenSuccesses,
        double trialSuccessRate,
        double currentFailureThreshold,
        long currentResetTimeoutMs,
        double avgResponseTimeMs) {
}
