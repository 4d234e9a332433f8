package com.example.ai.infra.resilience.retry;

import com.example.ai.infra.resilience.CancellationToken;
import com.example.ai.infra.resilience.OpenCircuitException;
import com.example.ai.infra.resilience.OperationCancelledException;
import com.example.ai.infra.resilience.RetryBudgetExhaustedException;
import com.example.ai.infra.resilience.breaker.CircuitBreaker;
import com.example.ai.infra.resilience.error.ErrorClassifier;
import com.example.ai.infra.resilience.error.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * {@link RetryPolicy} with three gates in front of and around the retry loop:
 * <ol>
 * <li>a retry budget per fixed time bucket, checked once on entry;</li>
 * <li>optional breaker coordination: the whole loop runs inside {@link CircuitBreaker#execute}, so an
 * open breaker refuses the entire sequence;</li>
 * <li>an adaptive multiplier in [0.5, 2.0] scaling every backoff delay, recomputed every 10 attempts
 * or 30 seconds from the success rate since the previous adjustment.</li>
 * </ol>
 */
public class AdvancedRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(AdvancedRetryPolicy.class);

    static final int ADJUST_EVERY_OPERATIONS = 10;
    static final long ADJUST_EVERY_MS = 30_000L;
    static final double MIN_MULTIPLIER = 0.5d;
    static final double MAX_MULTIPLIER = 2.0d;

    private final AdvancedRetryConfig config;
    private final RetryPolicy base;
    private final RetryBudget budget;
    private final Clock clock;
    private final AttemptObserver observer = new Bookkeeping();

    // guarded by this
    private long totalAttempts;
    private long successfulRetries;
    private long failedRetries;
    private long budgetExhausted;
    private long circuitRejections;
    private long totalDelayMs;
    private long adaptiveSuccesses;
    private long adaptiveFailures;
    private long lastAdjustmentMs;
    private double backoffMultiplier = 1.0d;

    public AdvancedRetryPolicy(AdvancedRetryConfig config) {
        this(config, null, Clock.systemUTC(), null);
    }

    public AdvancedRetryPolicy(AdvancedRetryConfig config, ErrorClassifier classifier, Clock clock,
                               ExecutorService attemptExecutor) {
        this(config, classifier, clock, attemptExecutor, Sleeper.TOKEN);
    }

    AdvancedRetryPolicy(AdvancedRetryConfig config, ErrorClassifier classifier, Clock clock,
                        ExecutorService attemptExecutor, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config").copy().validate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.base = new RetryPolicy(this.config, classifier, clock, attemptExecutor, sleeper);
        this.budget = new RetryBudget(this.config.getRetryBudget(), this.config.getBudgetWindowMs());
        this.lastAdjustmentMs = clock.millis();
    }

    public String getName() {
        return config.getName();
    }

    public AdvancedRetryConfig getConfig() {
        return config.copy();
    }

    public <T> T execute(RetryableOperation<T> operation) throws Exception {
        return execute(operation, null, null, CancellationToken.none());
    }

    public <T> T execute(RetryableOperation<T> operation, CircuitBreaker breaker) throws Exception {
        return execute(operation, null, breaker, CancellationToken.none());
    }

    /**
     * @param breaker optional; consulted only when {@code circuitBreakerIntegration} is on
     * @throws RetryBudgetExhaustedException when the current budget bucket is used up; nothing is invoked
     * @throws OpenCircuitException          when the coordinated breaker refuses the call
     */
    public <T> T execute(RetryableOperation<T> operation, ErrorType errorType, CircuitBreaker breaker,
                         CancellationToken cancellation) throws Exception {
        Objects.requireNonNull(operation, "operation");
        if (!budget.hasCapacity(clock.millis())) {
            synchronized (this) {
                budgetExhausted++;
            }
            log.warn("[AdvancedRetryPolicy] budget exhausted name={} budget={} windowMs={}",
                    config.getName(), budget.getBudget(), budget.getWindowMs());
            throw new RetryBudgetExhaustedException(config.getName(), budget.getBudget(), budget.getWindowMs());
        }

        if (config.isCircuitBreakerIntegration() && breaker != null) {
            try {
                return breaker.execute(() -> base.run(operation, errorType, cancellation, observer));
            } catch (OpenCircuitException rejected) {
                synchronized (this) {
                    circuitRejections++;
                }
                log.debug("[AdvancedRetryPolicy] rejected by breaker name={} breaker={} state={}",
                        config.getName(), rejected.name(), rejected.state());
                throw rejected;
            }
        }
        return base.run(operation, errorType, cancellation, observer);
    }

    /** The wrapped policy's delay computation, without the adaptive multiplier. */
    public long calculateDelay(int attemptIndex) {
        return base.calculateDelay(attemptIndex, config);
    }

    public synchronized RetryMetrics getMetrics() {
        long finished = successfulRetries + failedRetries;
        return new RetryMetrics(
                totalAttempts,
                successfulRetries,
                failedRetries,
                budgetExhausted,
                circuitRejections,
                totalAttempts == 0 ? 0.0d : (double) totalDelayMs / totalAttempts,
                finished == 0 ? 0.0d : (double) successfulRetries / finished);
    }

    public synchronized AdaptiveBackoffState getAdaptiveState() {
        return new AdaptiveBackoffState(adaptiveSuccesses, adaptiveFailures, lastAdjustmentMs, backoffMultiplier);
    }

    /** Units consumed in the current budget bucket. */
    public int getBudgetUsed() {
        return budget.used(clock.millis());
    }

    /** Clears metrics, adaptive state and budget buckets. */
    public void reset() {
        synchronized (this) {
            totalAttempts = 0L;
            successfulRetries = 0L;
            failedRetries = 0L;
            budgetExhausted = 0L;
            circuitRejections = 0L;
            totalDelayMs = 0L;
            adaptiveSuccesses = 0L;
            adaptiveFailures = 0L;
            lastAdjustmentMs = clock.millis();
            backoffMultiplier = 1.0d;
        }
        budget.reset();
    }

    // caller holds the monitor
    private void updateAdaptive(boolean success) {
        if (!config.isAdaptiveBackoff()) {
            return;
        }
        if (success) {
            adaptiveSuccesses++;
        } else {
            adaptiveFailures++;
        }
        long ops = adaptiveSuccesses + adaptiveFailures;
        long now = clock.millis();
        if (ops >= ADJUST_EVERY_OPERATIONS || now - lastAdjustmentMs >= ADJUST_EVERY_MS) {
            double rate = (double) adaptiveSuccesses / ops;
            double before = backoffMultiplier;
            backoffMultiplier = rate < config.getAdaptiveThreshold()
                    ? Math.min(MAX_MULTIPLIER, backoffMultiplier * 1.5d)
                    : Math.max(MIN_MULTIPLIER, backoffMultiplier * 0.8d);
            adaptiveSuccesses = 0L;
            adaptiveFailures = 0L;
            lastAdjustmentMs = now;
            log.debug("[AdvancedRetryPolicy] multiplier name={} {} -> {} successRate={}",
                    config.getName(), before, backoffMultiplier, rate);
        }
    }

    private final class Bookkeeping implements AttemptObserver {

        @Override
        public long adjustDelay(long computedDelayMs, RetryPolicyConfig cfg) {
            if (!config.isAdaptiveBackoff()) {
                return computedDelayMs;
            }
            double m;
            synchronized (AdvancedRetryPolicy.this) {
                m = backoffMultiplier;
            }
            return Math.min(cfg.getMaxDelayMs(), (long) Math.floor(computedDelayMs * m));
        }

        @Override
        public void onAttemptStart(RetryAttempt attempt) {
            synchronized (AdvancedRetryPolicy.this) {
                totalAttempts++;
                totalDelayMs += attempt.delayMs();
            }
        }

        @Override
        public void onAttemptSuccess(RetryAttempt attempt) {
            budget.consume(clock.millis());
            synchronized (AdvancedRetryPolicy.this) {
                updateAdaptive(true);
                if (attempt.attempt() > 0) {
                    successfulRetries++;
                }
            }
        }

        @Override
        public void onAttemptFailure(RetryAttempt attempt, Throwable error, boolean willRetry) {
            if (willRetry) {
                budget.consume(clock.millis());
            }
            synchronized (AdvancedRetryPolicy.this) {
                updateAdaptive(false);
                if (!willRetry && !OperationCancelledException.isCancellation(error)) {
                    failedRetries++;
                }
            }
        }
    }
}
