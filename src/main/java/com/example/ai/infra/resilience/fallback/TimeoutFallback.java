package com.example.ai.infra.resilience.fallback;

import com.example.ai.infra.resilience.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the primary operation on {@code executor} with a time bound; a timeout or failure switches to the
 * fallback operation. A timed-out primary is cancelled with interrupt. Cancellation is passed through.
 */
public class TimeoutFallback<T> implements FallbackStrategy<T> {

    private static final Logger log = LoggerFactory.getLogger(TimeoutFallback.class);

    private final Callable<T> primary;
    private final Callable<T> fallback;
    private final long timeoutMs;
    private final ExecutorService executor;
    private final double qualityScore;

    public TimeoutFallback(Callable<T> primary, Callable<T> fallback, long timeoutMs, ExecutorService executor) {
        this(primary, fallback, timeoutMs, executor, 0.7d);
    }

    public TimeoutFallback(Callable<T> primary, Callable<T> fallback, long timeoutMs, ExecutorService executor,
                           double qualityScore) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0: " + timeoutMs);
        }
        this.primary = Objects.requireNonNull(primary, "primary");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.timeoutMs = timeoutMs;
        this.executor = Objects.requireNonNull(executor, "executor");
        this.qualityScore = Fallbacks.checkQuality(qualityScore);
    }

    @Override
    public T execute() throws Exception {
        Future<T> task = executor.submit(primary);
        try {
            return task.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            task.cancel(true);
            log.debug("[Fallback] primary timed out after {}ms, using fallback", timeoutMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            throw new OperationCancelledException("Interrupted while waiting for primary", ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (OperationCancelledException.isCancellation(cause)) {
                throw cause instanceof Exception ex ? ex : ee;
            }
            log.debug("[Fallback] primary failed, using fallback err={}", String.valueOf(cause));
        }
        return fallback.call();
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
