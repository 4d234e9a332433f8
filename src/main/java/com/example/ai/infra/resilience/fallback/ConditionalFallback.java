package com.example.ai.infra.resilience.fallback;

import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Routes to {@code fallback} while {@code useFallback} holds, to {@code primary} otherwise.
 */
public class ConditionalFallback<T> implements FallbackStrategy<T> {

    private final BooleanSupplier useFallback;
    private final FallbackStrategy<? extends T> primary;
    private final FallbackStrategy<? extends T> fallback;

    public ConditionalFallback(BooleanSupplier useFallback, FallbackStrategy<? extends T> primary,
                               FallbackStrategy<? extends T> fallback) {
        this.useFallback = Objects.requireNonNull(useFallback, "useFallback");
        this.primary = Objects.requireNonNull(primary, "primary");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public T execute() throws Exception {
        return useFallback.getAsBoolean() ? fallback.execute() : primary.execute();
    }

    @Override
    public boolean isAvailable() {
        return useFallback.getAsBoolean() ? fallback.isAvailable() : primary.isAvailable();
    }

    /** Mean of both branches. */
    @Override
    public double getQualityScore() {
        return (primary.getQualityScore() + fallback.getQualityScore()) / 2.0d;
    }

    @Override
    public void cleanup() {
        Fallbacks.cleanupAll(List.of(primary, fallback));
    }
}
