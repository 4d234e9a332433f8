package com.example.ai.infra.resilience.retry;

/**
 * Hooks into the retry loop for policies that layer bookkeeping on top of {@link RetryPolicy}.
 */
interface AttemptObserver {

    AttemptObserver NONE = new AttemptObserver() {
    };

    /** Final delay before a retry, given the computed one. */
    default long adjustDelay(long computedDelayMs, RetryPolicyConfig config) {
        return computedDelayMs;
    }

    default void onAttemptStart(RetryAttempt attempt) {
    }

    default void onAttemptSuccess(RetryAttempt attempt) {
    }

    /**
     * @param willRetry false when this failure ends the loop
     */
    default void onAttemptFailure(RetryAttempt attempt, Throwable error, boolean willRetry) {
    }
}
