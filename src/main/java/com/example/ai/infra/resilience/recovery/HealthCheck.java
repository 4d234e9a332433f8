package com.example.ai.infra.resilience.recovery;

import com.example.ai.infra.resilience.AttemptTimeoutException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Caller-supplied probe; {@code true} means the service answers normally. A thrown exception counts as
 * unhealthy.
 */
@FunctionalInterface
public interface HealthCheck {

    boolean check() throws Exception;

    /**
     * Adapts an asynchronous probe. A probe that does not complete within {@code timeout} fails with
     * {@link AttemptTimeoutException}; a null result counts as unhealthy.
     */
    static HealthCheck async(Supplier<? extends CompletionStage<Boolean>> probe, Duration timeout) {
        Objects.requireNonNull(probe, "probe");
        Objects.requireNonNull(timeout, "timeout");
        return () -> {
            CompletionStage<Boolean> stage = probe.get();
            if (stage == null) {
                return false;
            }
            try {
                Boolean ok = stage.toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                return Boolean.TRUE.equals(ok);
            } catch (TimeoutException te) {
                throw new AttemptTimeoutException(timeout.toMillis());
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause();
                if (cause instanceof Exception ex) {
                    throw ex;
                }
                throw ee;
            }
        };
    }
}
