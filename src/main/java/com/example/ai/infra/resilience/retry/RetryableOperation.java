package com.example.ai.infra.resilience.retry;

/**
 * An operation invoked once per attempt.
 */
@FunctionalInterface
public interface RetryableOperation<T> {

    T call(RetryAttempt attempt) throws Exception;
}
