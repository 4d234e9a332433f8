package com.example.ai.infra.resilience.error;

/**
 * Result of classifying one failure.
 *
 * @param statusCode   HTTP-like status when the failure carried one, else null
 * @param retryAfterMs server-suggested wait before the next attempt, else null
 */
public record ErrorInfo(ErrorType type, boolean retryable, Integer statusCode, String message, Long retryAfterMs) {

    public static ErrorInfo of(ErrorType type, String message) {
        return new ErrorInfo(type, type.isRetryable(), null, message, null);
    }
}
