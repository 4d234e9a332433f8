package com.example.ai.infra.resilience.fallback;

import com.example.ai.infra.resilience.FallbackUnavailableException;
import com.google.common.util.concurrent.RateLimiter;

import java.util.Objects;

/**
 * Throttles how often the wrapped fallback may run. A call beyond the rate is refused without waiting.
 *
 * <p>{@link #isAvailable()} reflects the wrapped strategy only; taking a permit happens in {@link #execute()}.</p>
 */
public class RateLimitedFallback<T> implements FallbackStrategy<T> {

    private final FallbackStrategy<? extends T> strategy;
    private final RateLimiter limiter;

    public RateLimitedFallback(FallbackStrategy<? extends T> strategy, double permitsPerSecond) {
        this(strategy, RateLimiter.create(permitsPerSecond));
    }

    public RateLimitedFallback(FallbackStrategy<? extends T> strategy, RateLimiter limiter) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
    }

    /**
     * @throws FallbackUnavailableException when no permit is free right now
     */
    @Override
    public T execute() throws Exception {
        if (!limiter.tryAcquire()) {
            throw new FallbackUnavailableException("Fallback rate limit exceeded: " + limiter.getRate() + "/s");
        }
        return strategy.execute();
    }

    @Override
    public boolean isAvailable() {
        return strategy.isAvailable();
    }

    /** Slightly below the wrapped score. */
    @Override
    public double getQualityScore() {
        return strategy.getQualityScore() * 0.9d;
    }

    @Override
    public void cleanup() {
        strategy.cleanup();
    }
}
