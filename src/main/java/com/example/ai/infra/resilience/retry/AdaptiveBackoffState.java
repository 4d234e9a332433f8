package com.example.ai.infra.resilience.retry;

/**
 * Snapshot of the adaptive backoff loop.
 *
 * @param multiplier factor applied to every computed delay, within [0.5, 2.0]
 */
public record AdaptiveBackoffState(long successCount, long failureCount, long lastAdjustmentMs, double multiplier) {
}
