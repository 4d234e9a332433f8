package com.example.ai.infra.resilience.retry;

/**
 * Counters of an {@link AdvancedRetryPolicy} since creation or the last reset.
 *
 * @param successfulRetries        operations that succeeded on a retry (attempt &gt; 0)
 * @param failedRetries            operations that ran out of attempts
 * @param circuitBreakerRejections operations refused by the coordinated breaker
 * @param averageDelayMs           total backoff slept divided by total attempts
 * @param successRate              successfulRetries / (successfulRetries + failedRetries), 0 when both are 0
 */
public record RetryMetrics(
        long totalAttempts,
        long successfulRetries,
        long failedRetries,
        long budgetExhausted,
        long circuitBreakerRejections,
        double averageDelayMs,
        double successRate) {
}
