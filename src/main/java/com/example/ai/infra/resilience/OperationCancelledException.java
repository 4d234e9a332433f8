package com.example.ai.infra.resilience;

/**
 * Cooperative cancellation was observed. Never retried.
 */
public class OperationCancelledException extends ResilienceException {

    public OperationCancelledException(String message) {
        super(message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * True for the cancellation shapes the JDK and this library produce.
     */
    public static boolean isCancellation(Throwable t) {
        Throwable cur = t;
        int guard = 0;
        while (cur != null && guard++ < 12) {
            if (cur instanceof OperationCancelledException
                    || cur instanceof java.util.concurrent.CancellationException
                    || cur instanceof InterruptedException) {
                return true;
            }
            if (cur.getCause() == cur) {
                break;
            }
            cur = cur.getCause();
        }
        return false;
    }
}
