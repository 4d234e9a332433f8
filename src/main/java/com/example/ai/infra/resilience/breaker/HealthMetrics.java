package com.example.ai.infra.resilience.breaker;

/**
 * Derived health snapshot of an {@link AdaptiveCircuitBreaker}. Informational; the breaker state never
 * depends on it.
 *
 * @param healthScore rounded 0-100
 */
public record HealthMetrics(
        int healthScore,
        int consecutiveSuccesses,
        int consecutiveFailures,
        double failureRate,
        double avgResponseTimeMs,
        long lastSuccessMs,
        long lastFailureMs,
        int tripCount) {
}
