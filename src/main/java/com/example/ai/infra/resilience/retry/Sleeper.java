package com.example.ai.infra.resilience.retry;

import com.example.ai.infra.resilience.CancellationToken;

/**
 * Backoff wait. Production code sleeps on the cancellation token; tests substitute a recorder.
 */
@FunctionalInterface
interface Sleeper {

    Sleeper TOKEN = (millis, token) -> token.sleep(millis);

    void sleep(long millis, CancellationToken token);
}
