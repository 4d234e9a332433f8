package com.example.ai.infra.resilience;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cooperative cancellation signal shared between a caller and the retry loop.
 *
 * <p>Cancelling aborts a pending backoff sleep and the wait on the current attempt. It does not stop
 * an operation that is already running; the operation has to check {@link #isCancelled()} itself.</p>
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final CompletableFuture<String> signal = new CompletableFuture<>();

    /** A token that is never cancelled. */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        cancel("cancelled");
    }

    public void cancel(String reason) {
        if (this == NONE) {
            return;
        }
        signal.complete(reason == null ? "cancelled" : reason);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /** Completes with the cancellation reason. */
    public CompletableFuture<String> whenCancelled() {
        return signal;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException("Operation cancelled: " + signal.getNow("cancelled"));
        }
    }

    /**
     * Sleeps for {@code millis} unless cancelled first.
     *
     * @throws OperationCancelledException when cancelled before or during the sleep
     */
    public void sleep(long millis) {
        throwIfCancelled();
        if (millis <= 0) {
            return;
        }
        try {
            signal.get(millis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException elapsed) {
            return;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Sleep interrupted", ie);
        } catch (ExecutionException ee) {
            throw new IllegalStateException("cancellation signal failed", ee.getCause());
        }
        throw new OperationCancelledException("Sleep cancelled: " + signal.getNow("cancelled"));
    }
}
