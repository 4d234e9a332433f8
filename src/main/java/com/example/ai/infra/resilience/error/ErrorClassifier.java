package com.example.ai.infra.resilience.error;

/**
 * Maps a failure to an {@link ErrorInfo}. Implementations must not throw.
 */
@FunctionalInterface
public interface ErrorClassifier {

    ErrorInfo classify(Throwable error);
}
