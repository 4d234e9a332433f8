package com.example.ai.infra.resilience.error;

/**
 * Implemented by exceptions that carry a transport status, so classification does not depend on
 * message text.
 */
public interface StatusCodeAware {

    int statusCode();

    /** Retry-After hint in milliseconds, or null. */
    default Long retryAfterMs() {
        return null;
    }
}
