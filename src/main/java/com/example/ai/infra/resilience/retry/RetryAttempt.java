package com.example.ai.infra.resilience.retry;

/**
 * Handed to the operation on every attempt.
 *
 * @param attempt       zero-based attempt index
 * @param delayMs       delay slept before this attempt (0 for the first)
 * @param elapsedMs     time since the retry loop started
 * @param previousError failure of the previous attempt, null on the first
 */
public record RetryAttempt(int attempt, long delayMs, long elapsedMs, Throwable previousError) {

    public boolean isRetry() {
        return attempt > 0;
    }
}
