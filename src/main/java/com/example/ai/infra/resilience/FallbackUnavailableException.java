package com.example.ai.infra.resilience;

/**
 * A fallback refused to produce a value: throttled, guarded by an open breaker, or every alternative
 * in a chain failed. Failures of the alternatives are attached as suppressed exceptions.
 */
public class FallbackUnavailableException extends ResilienceException {

    public FallbackUnavailableException(String message) {
        super(message);
    }
}
