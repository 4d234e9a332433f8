package com.example.ai.infra.resilience.breaker;

/**
 * One recorded call result.
 *
 * @param timestampMs completion time (epoch millis, breaker clock)
 * @param success     whether the call completed normally
 * @param durationMs  wall time spent in the operation
 */
public record RequestOutcome(long timestampMs, boolean success, long durationMs) {
}
