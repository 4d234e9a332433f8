package com.example.ai.infra.resilience.breaker;

import com.example.ai.infra.resilience.OpenCircuitException;
import com.example.ai.infra.resilience.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Health-scored wrapper around a {@link CircuitBreaker}.
 *
 * <p>The wrapped breaker keeps its own state machine; this class only observes outcomes and
 * transitions and pushes a tuned failure threshold and reset timeout back into it. Business code may
 * keep calling the wrapped breaker directly; transitions caused that way are still observed, outcomes
 * are not.</p>
 */
public class AdaptiveCircuitBreaker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveCircuitBreaker.class);

    private static final int SUCCESS_BONUS = 2;
    private static final int FAILURE_PENALTY = 5;
    private static final double HEALTHY_SCORE = 80.0d;

    private final CircuitBreaker delegate;
    private final CircuitBreakerProperties props;
    private final Clock clock;
    private final CircuitStateListener transitionObserver = this::onTransition;

    // guarded by this
    private double streakScore = 100.0d;
    private double healthScore = 100.0d;
    private long lastHealthUpdateMs;
    private int consecutiveSuccesses;
    private int consecutiveFailures;
    private long lastSuccessMs;
    private long lastFailureMs;
    private int tripCount;
    private int failedTrialBursts;
    private double currentThreshold;
    private long currentResetTimeoutMs;

    public AdaptiveCircuitBreaker(CircuitBreaker delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.props = delegate.getProperties();
        this.clock = delegate.clock();
        this.currentThreshold = initialThreshold();
        this.currentResetTimeoutMs = props.getResetTimeoutMs();
        this.lastHealthUpdateMs = clock.millis();
        delegate.tune(currentThreshold, currentResetTimeoutMs);
        delegate.addListener(transitionObserver);
    }

    // adjustments stay inside [min, max], so the starting point does too
    private double initialThreshold() {
        if (!props.isAdaptiveThresholds()) {
            return props.getFailureThreshold();
        }
        return clamp(props.getFailureThreshold(), props.getMinFailureThreshold(), props.getMaxFailureThreshold());
    }

    public CircuitBreaker getDelegate() {
        return delegate;
    }

    public String getName() {
        return delegate.getName();
    }

    public CircuitState getState() {
        return delegate.getState();
    }

    public CircuitBreakerStats getStats() {
        return delegate.getStats();
    }

    public void reset() {
        delegate.reset();
    }

    public void forceOpen(String reason) {
        delegate.forceOpen(reason);
    }

    /**
     * Same contract as {@link CircuitBreaker#execute(Callable)}; additionally feeds the outcome into the
     * health score and adaptive parameters. Rejections are not outcomes and change nothing here.
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        T result;
        try {
            result = delegate.execute(operation);
        } catch (OpenCircuitException rejected) {
            throw rejected;
        } catch (Exception | Error e) {
            if (!OperationCancelledException.isCancellation(e) || props.isCancellationCountsAsFailure()) {
                recordOutcome(false);
            }
            throw e;
        }
        recordOutcome(true);
        return result;
    }

    private void recordOutcome(boolean success) {
        double threshold;
        long timeout;
        synchronized (this) {
            long now = clock.millis();
            if (success) {
                consecutiveSuccesses++;
                consecutiveFailures = 0;
                lastSuccessMs = now;
            } else {
                consecutiveFailures++;
                consecutiveSuccesses = 0;
                lastFailureMs = now;
            }
            CircuitBreakerStats stats = delegate.getStats();
            if (props.isHealthScoreEnabled()) {
                decayHealth(now);
                streakScore = success
                        ? Math.min(100.0d, streakScore + SUCCESS_BONUS)
                        : Math.max(0.0d, streakScore - FAILURE_PENALTY);
                double rateScore = (1.0d - stats.failureRate()) * 100.0d;
                healthScore = clamp(0.5d * streakScore + 0.5d * rateScore, 0.0d, 100.0d);
            }
            if (props.isAdaptiveThresholds()) {
                adjustThreshold(stats);
            }
            if (props.isAdaptiveTimeout() && healthScore > HEALTHY_SCORE && stats.state() == CircuitState.CLOSED) {
                currentResetTimeoutMs = Math.max(props.getMinResetTimeoutMs(), (long) (currentResetTimeoutMs * 0.9d));
            }
            threshold = currentThreshold;
            timeout = currentResetTimeoutMs;
        }
        delegate.tune(threshold, timeout);
    }

    // caller holds the monitor
    private void decayHealth(long now) {
        long windowMs = props.getMonitoringWindowMs();
        long elapsed = now - lastHealthUpdateMs;
        if (elapsed >= windowMs) {
            long windows = elapsed / windowMs;
            double factor = Math.pow(1.0d - props.getHealthDecayRate(), windows);
            streakScore = Math.max(0.0d, streakScore * factor);
            lastHealthUpdateMs = now;
        }
    }

    // caller holds the monitor
    private void adjustThreshold(CircuitBreakerStats stats) {
        if (stats.totalRequests() < props.getRequestThreshold()) {
            return;
        }
        double rate = stats.failureRate();
        double before = currentThreshold;
        if (rate < currentThreshold * 0.7d) {
            currentThreshold = Math.max(props.getMinFailureThreshold(), currentThreshold * 0.9d);
        } else if (rate > currentThreshold * 0.9d) {
            currentThreshold = Math.min(props.getMaxFailureThreshold(), currentThreshold * 1.1d);
        }
        if (before != currentThreshold) {
            log.debug("[AdaptiveCircuitBreaker] threshold name={} {} -> {} (failureRate={})",
                    delegate.getName(), before, currentThreshold, rate);
        }
    }

    private void onTransition(String breakerName, CircuitState from, CircuitState to, String reason) {
        Long timeout = null;
        synchronized (this) {
            if (to == CircuitState.OPEN && from == CircuitState.CLOSED) {
                tripCount++;
            } else if (to == CircuitState.OPEN && from == CircuitState.HALF_OPEN) {
                failedTrialBursts++;
                if (props.isAdaptiveTimeout() && failedTrialBursts >= 2) {
                    currentResetTimeoutMs = Math.min(props.getMaxResetTimeoutMs(), (long) (currentResetTimeoutMs * 1.5d));
                    timeout = currentResetTimeoutMs;
                    log.debug("[AdaptiveCircuitBreaker] reset timeout raised name={} timeoutMs={} failedBursts={}",
                            breakerName, currentResetTimeoutMs, failedTrialBursts);
                }
            } else if (to == CircuitState.CLOSED) {
                failedTrialBursts = 0;
            }
        }
        if (timeout != null) {
            delegate.tune(currentThresholdSnapshot(), timeout);
        }
    }

    private synchronized double currentThresholdSnapshot() {
        return currentThreshold;
    }

    public synchronized HealthMetrics getHealthMetrics() {
        long now = clock.millis();
        if (props.isHealthScoreEnabled()) {
            decayHealth(now);
        }
        CircuitBreakerStats stats = delegate.getStats();
        return new HealthMetrics(
                (int) Math.round(healthScore),
                consecutiveSuccesses,
                consecutiveFailures,
                stats.failureRate(),
                stats.avgResponseTimeMs(),
                lastSuccessMs,
                lastFailureMs,
                tripCount);
    }

    public synchronized AdaptiveThresholds getAdaptiveThresholds() {
        return new AdaptiveThresholds(
                currentThreshold,
                currentResetTimeoutMs,
                props.getFailureThreshold(),
                props.getResetTimeoutMs(),
                failedTrialBursts);
    }

    /** Clears health tracking and restores the starting threshold and configured timeout. */
    public void resetMetrics() {
        double threshold;
        long timeout;
        synchronized (this) {
            streakScore = 100.0d;
            healthScore = 100.0d;
            lastHealthUpdateMs = clock.millis();
            consecutiveSuccesses = 0;
            consecutiveFailures = 0;
            lastSuccessMs = 0L;
            lastFailureMs = 0L;
            tripCount = 0;
            failedTrialBursts = 0;
            currentThreshold = initialThreshold();
            currentResetTimeoutMs = props.getResetTimeoutMs();
            threshold = currentThreshold;
            timeout = currentResetTimeoutMs;
        }
        delegate.tune(threshold, timeout);
    }

    @Override
    public void close() {
        delegate.removeListener(transitionObserver);
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
