package com.example.ai.infra.resilience.fallback;

/**
 * Alternative source of a value when the primary call cannot be used.
 *
 * @param <T> value type
 */
public interface FallbackStrategy<T> {

    T execute() throws Exception;

    /** Cheap check callers make before {@link #execute()}. Must not throw. */
    boolean isAvailable();

    /** Relative quality of the value this strategy produces, 0 to 1. */
    double getQualityScore();

    default void cleanup() {
    }
}
