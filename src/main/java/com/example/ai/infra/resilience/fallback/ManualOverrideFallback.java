package com.example.ai.infra.resilience.fallback;

import java.util.Objects;

/**
 * Lets an operator pin a response. While an override is active it is returned instead of calling the
 * wrapped strategy.
 */
public class ManualOverrideFallback<T> implements FallbackStrategy<T> {

    private final FallbackStrategy<? extends T> strategy;
    private final double qualityScore;
    private volatile T override;

    public ManualOverrideFallback(FallbackStrategy<? extends T> strategy) {
        this(strategy, 0.9d);
    }

    public ManualOverrideFallback(FallbackStrategy<? extends T> strategy, double qualityScore) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.qualityScore = Fallbacks.checkQuality(qualityScore);
    }

    @Override
    public T execute() throws Exception {
        T pinned = override;
        return pinned != null ? pinned : strategy.execute();
    }

    @Override
    public boolean isAvailable() {
        return override != null || strategy.isAvailable();
    }

    @Override
    public double getQualityScore() {
        return qualityScore;
    }

    public void activateOverride(T response) {
        this.override = Objects.requireNonNull(response, "response");
    }

    public void deactivateOverride() {
        this.override = null;
    }

    public boolean isOverrideActive() {
        return override != null;
    }

    @Override
    public void cleanup() {
        deactivateOverride();
        strategy.cleanup();
    }
}
