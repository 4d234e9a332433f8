package com.example.ai.infra.resilience;

/**
 * Every allowed attempt failed. {@link #getCause()} is the error of the last attempt.
 */
public class RetryExhaustedException extends ResilienceException {
    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("Operation failed after " + attempts + " attempts: "
                + (lastError == null ? "unknown" : lastError.getMessage()), lastError);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
