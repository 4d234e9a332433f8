package com.example.ai.infra.resilience;

import com.example.ai.infra.resilience.breaker.CircuitState;

import java.time.Duration;

/**
 * Thrown by a circuit breaker that refuses to invoke the operation: either OPEN with the reset timeout
 * still running, or HALF_OPEN with every trial slot of the episode already taken.
 */
public class OpenCircuitException extends ResilienceException {
    private final String name;
    private final Duration remaining;
    private final CircuitState state;

    public OpenCircuitException(String name, Duration remaining, CircuitState state) {
        super("Circuit breaker is " + state + ": name=" + name + ", remaining=" + remaining);
        this.name = name;
        this.remaining = remaining;
        this.state = state;
    }

    public String name() {
        return name;
    }

    public Duration remaining() {
        return remaining;
    }

    public CircuitState state() {
        return state;
    }
}
