package com.example.ai.infra.resilience.breaker;

/** Circuit breaker mode: CLOSED → OPEN → HALF_OPEN → CLOSED. */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    /** Numeric code for gauges: 0 closed, 1 half-open, 2 open. */
    public int code() {
        switch (this) {
            case OPEN:
                return 2;
            case HALF_OPEN:
                return 1;
            default:
                return 0;
        }
    }
}
