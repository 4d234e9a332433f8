package com.example.ai.infra.resilience.breaker;

/**
 * Live values the adaptive wrapper has pushed into its breaker, next to the configured ones.
 */
public record AdaptiveThresholds(
        double failureThreshold,
        long resetTimeoutMs,
        double configuredFailureThreshold,
        long configuredResetTimeoutMs,
        int consecutiveFailedTrialBursts) {
}
