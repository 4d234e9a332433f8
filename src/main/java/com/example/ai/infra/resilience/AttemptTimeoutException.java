package com.example.ai.infra.resilience;

/**
 * A single attempt exceeded its time bound. Counted like any other failure.
 */
public class AttemptTimeoutException extends ResilienceException {
    private final long timeoutMs;

    public AttemptTimeoutException(long timeoutMs) {
        super("Operation timed out after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
