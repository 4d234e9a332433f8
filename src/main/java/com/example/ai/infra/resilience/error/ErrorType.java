package com.example.ai.infra.resilience.error;

import java.util.Locale;

/**
 * Actionable error categories; the retry policy selects per-type overrides by these.
 */
public enum ErrorType {
    TRANSIENT(true),
    RATE_LIMIT(true),
    AUTHENTICATION(false),
    VALIDATION(false),
    NOT_FOUND(false),
    PERMISSION(false),
    SERVER_ERROR(true),
    CLIENT_ERROR(false),
    NETWORK(true),
    TIMEOUT(true),
    CANCELLED(false),
    UNKNOWN(false);

    private final boolean retryable;

    ErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** Lower-case code used in config keys and event payloads, e.g. {@code rate_limit}. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
