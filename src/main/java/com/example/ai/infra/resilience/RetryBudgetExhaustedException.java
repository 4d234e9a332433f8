package com.example.ai.infra.resilience;

/**
 * Retry budget of the current window is spent; the operation was not invoked.
 */
public class RetryBudgetExhaustedException extends ResilienceException {
    private final int budget;
    private final long windowMs;

    public RetryBudgetExhaustedException(String policyName, int budget, long windowMs) {
        super("Retry budget exhausted: policy=" + policyName + ", " + budget + " retries in " + windowMs + "ms window");
        this.budget = budget;
        this.windowMs = windowMs;
    }

    public int budget() {
        return budget;
    }

    public long windowMs() {
        return windowMs;
    }
}
