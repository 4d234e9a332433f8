package com.example.ai.infra.resilience.fallback;

/**
 * Always returns the same canned value.
 */
public class StaticResponseFallback<T> implements FallbackStrategy<T> {

    private final T response;
    private final double qualityScore;

    public StaticResponseFallback(T response) {
        this(response, 0.5d);
    }

    public StaticResponseFallback(T response, double qualityScore) {
        this.response = response;
        this.qualityScore = Fallbacks.checkQuality(qualityScore);
    }

    @Override
    public T execute() {
        return response;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public double getQualityScore() {
        return qualityScore;
    }
}
