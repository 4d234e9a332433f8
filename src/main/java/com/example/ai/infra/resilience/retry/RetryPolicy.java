package com.example.ai.infra.resilience.retry;

import com.example.ai.infra.resilience.AttemptTimeoutException;
import com.example.ai.infra.resilience.CancellationToken;
import com.example.ai.infra.resilience.OperationCancelledException;
import com.example.ai.infra.resilience.RetryExhaustedException;
import com.example.ai.infra.resilience.error.ErrorClassifier;
import com.example.ai.infra.resilience.error.ErrorInfo;
import com.example.ai.infra.resilience.error.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Re-invokes a failing operation up to {@code maxRetries} more times with a computed backoff.
 *
 * <p>No delay precedes the first attempt. The delay before attempt {@code i} is
 * {@link #calculateDelay(int, RetryPolicyConfig) calculateDelay(i - 1)}, skipped for {@code i == 1}
 * when {@code retryImmediately} is set. Every attempt is bounded by {@code timeoutMs}; a timed-out
 * attempt is retried like any other failure. Cancellation is never retried.</p>
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryPolicyConfig config;
    private final ErrorClassifier classifier;
    private final Clock clock;
    private final ExecutorService attemptExecutor;
    private final Sleeper sleeper;

    public RetryPolicy() {
        this(new RetryPolicyConfig());
    }

    public RetryPolicy(RetryPolicyConfig config) {
        this(config, null);
    }

    /**
     * @param classifier optional; when present, failures without an explicit error type are classified
     *                   and the matching per-type override takes over
     */
    public RetryPolicy(RetryPolicyConfig config, ErrorClassifier classifier) {
        this(config, classifier, Clock.systemUTC(), null);
    }

    /**
     * @param attemptExecutor runs attempts bounded by {@code timeoutMs}; null gives this policy its own
     *                        {@link #newAttemptExecutor() attempt pool}
     */
    public RetryPolicy(RetryPolicyConfig config, ErrorClassifier classifier, Clock clock, ExecutorService attemptExecutor) {
        this(config, classifier, clock, attemptExecutor, Sleeper.TOKEN);
    }

    RetryPolicy(RetryPolicyConfig config, ErrorClassifier classifier, Clock clock,
                ExecutorService attemptExecutor, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config").copy().validate();
        this.classifier = classifier;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.attemptExecutor = attemptExecutor == null ? newAttemptExecutor() : attemptExecutor;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public RetryPolicyConfig getConfig() {
        return config.copy();
    }

    public <T> T execute(RetryableOperation<T> operation) throws Exception {
        return execute(operation, null, CancellationToken.none());
    }

    public <T> T execute(RetryableOperation<T> operation, ErrorType errorType) throws Exception {
        return execute(operation, errorType, CancellationToken.none());
    }

    /**
     * Runs the retry loop.
     *
     * @param errorType    selects the per-type override up front; null lets the classifier (if any) pick
     * @param cancellation aborts the backoff sleep and the wait on the running attempt
     * @return the first successful result
     * @throws RetryExhaustedException      after the last allowed attempt failed, or a classified failure
     *                                      was not retryable; the cause is the last failure
     * @throws OperationCancelledException when cancelled, or when the operation itself reported cancellation
     */
    public <T> T execute(RetryableOperation<T> operation, ErrorType errorType, CancellationToken cancellation)
            throws Exception {
        return run(operation, errorType, cancellation, AttemptObserver.NONE);
    }

    <T> T run(RetryableOperation<T> operation, ErrorType errorType, CancellationToken cancellation,
              AttemptObserver observer) throws Exception {
        Objects.requireNonNull(operation, "operation");
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        RetryPolicyConfig cfg = config.effective(errorType);
        long startedMs = clock.millis();
        Throwable lastError = null;
        Long retryAfterHintMs = null;

        for (int attempt = 0; ; attempt++) {
            token.throwIfCancelled();

            long delay = 0L;
            if (attempt > 0) {
                if (!(attempt == 1 && cfg.isRetryImmediately())) {
                    delay = observer.adjustDelay(calculateDelay(attempt - 1, cfg), cfg);
                }
                if (retryAfterHintMs != null) {
                    delay = Math.max(delay, Math.min(retryAfterHintMs, cfg.getMaxDelayMs()));
                }
                log.debug("[RetryPolicy] attempt={} delayMs={} lastError={}", attempt, delay, String.valueOf(lastError));
                sleeper.sleep(delay, token);
            }

            RetryAttempt info = new RetryAttempt(attempt, delay, clock.millis() - startedMs, lastError);
            observer.onAttemptStart(info);
            try {
                T result = invoke(operation, info, cfg.getTimeoutMs(), token);
                observer.onAttemptSuccess(info);
                return result;
            } catch (Exception e) {
                if (OperationCancelledException.isCancellation(e)) {
                    observer.onAttemptFailure(info, e, false);
                    throw (e instanceof OperationCancelledException oce)
                            ? oce
                            : new OperationCancelledException("Operation cancelled", e);
                }
                lastError = e;
                retryAfterHintMs = null;
                boolean retryable = true;
                if (errorType == null && classifier != null) {
                    ErrorInfo classified = classify(e);
                    if (classified != null) {
                        retryable = classified.retryable();
                        cfg = config.effective(classified.type());
                        retryAfterHintMs = classified.retryAfterMs();
                    }
                }
                boolean willRetry = retryable && attempt < cfg.getMaxRetries();
                observer.onAttemptFailure(info, e, willRetry);
                if (!willRetry) {
                    throw new RetryExhaustedException(attempt + 1, e);
                }
            }
        }
    }

    private ErrorInfo classify(Throwable e) {
        try {
            return classifier.classify(e);
        } catch (RuntimeException ex) {
            log.warn("[RetryPolicy] classifier failed err={}", ex.toString());
            return null;
        }
    }

    private <T> T invoke(RetryableOperation<T> operation, RetryAttempt info, long timeoutMs,
                         CancellationToken token) throws Exception {
        if (timeoutMs <= 0 && token == CancellationToken.none()) {
            return operation.call(info);
        }

        CompletableFuture<T> outcome = new CompletableFuture<>();
        Future<?> task = attemptExecutor.submit(() -> {
            try {
                outcome.complete(operation.call(info));
            } catch (Throwable t) {
                outcome.completeExceptionally(t);
            }
        });
        CompletableFuture<Void> cancelHook = token.whenCancelled().thenAccept(reason ->
                outcome.completeExceptionally(new OperationCancelledException("Operation cancelled: " + reason)));
        try {
            return timeoutMs > 0 ? outcome.get(timeoutMs, TimeUnit.MILLISECONDS) : outcome.get();
        } catch (TimeoutException te) {
            task.cancel(true);
            throw new AttemptTimeoutException(timeoutMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            throw new OperationCancelledException("Interrupted while waiting for attempt " + info.attempt(), ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(cause);
        } finally {
            cancelHook.cancel(false);
        }
    }

    /**
     * Jittered delay for zero-based retry index {@code attemptIndex}: the capped base delay perturbed by a
     * uniform ±{@code jitter * delay}, floored at zero and truncated to whole milliseconds.
     */
    public long calculateDelay(int attemptIndex, RetryPolicyConfig cfg) {
        double delay = baseDelay(attemptIndex, cfg);
        if (cfg.getJitter() > 0.0d) {
            double amount = delay * cfg.getJitter();
            delay = Math.max(0.0d, delay + (ThreadLocalRandom.current().nextDouble() * 2.0d - 1.0d) * amount);
        }
        return (long) Math.floor(delay);
    }

    /** Pre-jitter delay, capped at {@code maxDelayMs}. */
    public static double baseDelay(int attemptIndex, RetryPolicyConfig cfg) {
        int i = Math.max(0, attemptIndex);
        double delay;
        switch (cfg.getStrategy()) {
            case EXPONENTIAL:
                delay = cfg.getInitialDelayMs() * Math.pow(cfg.getMultiplier(), i);
                break;
            case LINEAR:
                delay = cfg.getInitialDelayMs() + cfg.getMultiplier() * i * 1000.0d;
                break;
            case FIXED:
            default:
                delay = cfg.getInitialDelayMs();
                break;
        }
        return Math.min(delay, (double) cfg.getMaxDelayMs());
    }

    /** Jittered delay for retry index {@code attemptIndex} under the config for {@code errorType}. */
    public long getExpectedDelay(int attemptIndex, ErrorType errorType) {
        return calculateDelay(attemptIndex, config.effective(errorType));
    }

    /**
     * Worst case wall time of one {@code execute}: every attempt running to its timeout plus every
     * pre-jitter backoff. Jitter can add up to {@code jitter} on top of each delay.
     */
    public long getMaxTotalTime(ErrorType errorType) {
        RetryPolicyConfig cfg = config.effective(errorType);
        long total = Math.max(0L, cfg.getTimeoutMs()) * (cfg.getMaxRetries() + 1L);
        for (int attempt = 1; attempt <= cfg.getMaxRetries(); attempt++) {
            if (attempt == 1 && cfg.isRetryImmediately()) {
                continue;
            }
            total += (long) baseDelay(attempt - 1, cfg);
        }
        return total;
    }

    /** Whether a failure of zero-based {@code attempt} would be retried. */
    public boolean shouldRetry(ErrorType errorType, int attempt) {
        return attempt < config.effective(errorType).getMaxRetries();
    }

    /** Cached pool of daemon threads named {@code retry-attempt-N}; idle threads exit after a minute. */
    public static ExecutorService newAttemptExecutor() {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "retry-attempt-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(factory);
    }
}
