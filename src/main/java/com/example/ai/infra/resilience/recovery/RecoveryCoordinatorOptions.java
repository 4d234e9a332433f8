package com.example.ai.infra.resilience.recovery;

import lombok.Getter;
import lombok.Setter;

/**
 * Coordinator settings. Bound under {@code ai.resilience.recovery} when used through Spring.
 */
@Getter
@Setter
public class RecoveryCoordinatorOptions {

    /** Run the periodic sweep after {@link RecoveryCoordinator#start()}. */
    private boolean autoRecover = false;
    private long checkIntervalMs = 30_000L;
    private int maxConcurrentRecoveries = 3;

    /** Event log ceiling; once exceeded the oldest entries are dropped down to {@code historyRetain}. */
    private int historyCapacity = 1_000;
    private int historyRetain = 500;

    public RecoveryCoordinatorOptions copy() {
        RecoveryCoordinatorOptions o = new RecoveryCoordinatorOptions();
        o.autoRecover = autoRecover;
        o.checkIntervalMs = checkIntervalMs;
        o.maxConcurrentRecoveries = maxConcurrentRecoveries;
        o.historyCapacity = historyCapacity;
        o.historyRetain = historyRetain;
        return o;
    }

    public RecoveryCoordinatorOptions validate() {
        if (checkIntervalMs <= 0) {
            throw new IllegalArgumentException("checkIntervalMs must be > 0: " + checkIntervalMs);
        }
        if (maxConcurrentRecoveries < 1) {
            throw new IllegalArgumentException("maxConcurrentRecoveries must be >= 1: " + maxConcurrentRecoveries);
        }
        if (historyRetain < 0 || historyRetain > historyCapacity) {
            throw new IllegalArgumentException("historyRetain must be in [0, historyCapacity]: " + historyRetain);
        }
        return this;
    }
}
