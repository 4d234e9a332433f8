package com.example.ai.infra.resilience;

/**
 * Base type for every synthetic failure raised by the resilience layer.
 *
 * <p>Errors thrown by the wrapped operation itself are never converted into this type,
 * except when retries are exhausted ({@link RetryExhaustedException} keeps the last error as cause).</p>
 */
public abstract class ResilienceException extends RuntimeException {

    protected ResilienceException(String message) {
        super(message);
    }

    protected ResilienceException(String message, Throwable cause) {
        super(message, cause);
    }
}
