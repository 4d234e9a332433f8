package com.example.ai.infra.resilience.fallback;

import com.example.ai.infra.resilience.FallbackUnavailableException;
import com.example.ai.infra.resilience.breaker.CircuitBreaker;
import com.example.ai.infra.resilience.breaker.CircuitState;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Guards a fallback that depends on another service with that service's breaker: refused while the
 * breaker reads OPEN.
 */
public class CircuitBreakerFallback<T> implements FallbackStrategy<T> {

    private final FallbackStrategy<? extends T> strategy;
    private final Supplier<CircuitState> circuitState;

    public CircuitBreakerFallback(FallbackStrategy<? extends T> strategy, CircuitBreaker breaker) {
        this(strategy, Objects.requireNonNull(breaker, "breaker")::getState);
    }

    public CircuitBreakerFallback(FallbackStrategy<? extends T> strategy, Supplier<CircuitState> circuitState) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.circuitState = Objects.requireNonNull(circuitState, "circuitState");
    }

    /**
     * @throws FallbackUnavailableException while the breaker is OPEN
     */
    @Override
    public T execute() throws Exception {
        if (circuitState.get() == CircuitState.OPEN) {
            throw new FallbackUnavailableException("Circuit breaker is open, fallback rejected");
        }
        return strategy.execute();
    }

    @Override
    public boolean isAvailable() {
        return circuitState.get() != CircuitState.OPEN && strategy.isAvailable();
    }

    @Override
    public double getQualityScore() {
        return strategy.getQualityScore();
    }

    @Override
    public void cleanup() {
        strategy.cleanup();
    }
}
