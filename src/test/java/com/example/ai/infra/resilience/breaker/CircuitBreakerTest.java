package com.example.ai.infra.resilience.breaker;

import com.example.ai.infra.resilience.MutableClock;
import com.example.ai.infra.resilience.OpenCircuitException;
import com.example.ai.infra.resilience.OperationCancelledException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private final MutableClock clock = MutableClock.atEpochMillis(1_000_000L);

    private static CircuitBreakerProperties props(double threshold, int requests) {
        CircuitBreakerProperties p = new CircuitBreakerProperties();
        p.setFailureThreshold(threshold);
        p.setRequestThreshold(requests);
        p.setResetTimeoutMs(10_000L);
        p.setMonitoringWindowMs(60_000L);
        p.setHalfOpenTrialCount(2);
        return p;
    }

    private static void failOnce(CircuitBreaker cb) {
        assertThrows(IllegalStateException.class, () -> cb.execute(() -> {
            throw new IllegalStateException("boom");
        }));
    }

    private static void succeedOnce(CircuitBreaker cb) throws Exception {
        assertEquals("ok", cb.execute(() -> "ok"));
    }

    @Test
    void failFailFailSuccess_tripsOnTheFourthOutcome() throws Exception {
        CircuitBreaker cb = new CircuitBreaker("llm", props(0.5, 4), clock);

        failOnce(cb);
        failOnce(cb);
        failOnce(cb);
        assertEquals(CircuitState.CLOSED, cb.getState(), "three outcomes are below requestThreshold");

        succeedOnce(cb);

        assertEquals(CircuitState.OPEN, cb.getState());
        CircuitBreakerStats stats = cb.getStats();
        assertEquals(0.75d, stats.failureRate(), 1e-9);
        assertEquals(4, stats.totalRequests());
    }

    @Test
    void continuedSuccess_staysClosedAndKeepsHistory() throws Exception {
        CircuitBreaker cb = new CircuitBreaker("llm", props(0.5, 4), clock);
        for (int i = 0; i < 6; i++) {
            succeedOnce(cb);
        }
        failOnce(cb);

        assertEquals(CircuitState.CLOSED, cb.getState());
        assertEquals(7, cb.getStats().totalRequests());
        assertEquals(1, cb.getStats().failures());
    }

    @Test
    void open_rejectsWithoutInvokingOrRecording() {
        CircuitBreaker cb = new CircuitBreaker("llm", props(0.5, 4), clock);
        cb.forceOpen("maintenance");
        clock.advanceMillis(4_000L);
        AtomicInteger calls = new AtomicInteger();

        OpenCircuitException ex = assertThrows(OpenCircuitException.class,
                () -> cb.execute(calls::incrementAndGet));

        assertEquals(0, calls.get());
        assertEquals("llm", ex.name());
        assertEquals(CircuitState.OPEN, ex.state());
        assertEquals(Duration.ofMillis(6_000L), ex.remaining());
        assertEquals(0, cb.getStats().totalRequests());
    }

    @Test
    void getState_neverTransitionsEvenAfterTimeout() {
        CircuitBreaker cb = new CircuitBreaker("llm", props(0.5, 4), clock);
        cb.forceOpen("test");
        clock.advanceMillis(20_000L);

        assertEquals(CircuitState.OPEN, cb.getState());
        assertEquals(CircuitState.OPEN, cb.getState());
    }

    @Test
    void halfOpen_admitsTrialsUntilCountThenClosesWhenAllSucceed() throws Exception {
        CircuitBreaker cb = new CircuitBreaker("llm", props(0.5, 4), clock);
        cb.forceOpen("test");
        clock.advanceMillis(10_000L);

        succeedOnce(cb);
        assertEquals(CircuitState.HALF_OPEN, cb.getState());
        assertEquals(1, cb.getStats().halfOpenSuccesses());

        succeedOnce(cb);
        assertEquals(CircuitState.CLOSED, cb.getState());
        assertEquals(0, cb.getStats().totalRequests(), "closing clears history");
    }

    @Test
    void halfOpen_rejectsBeyondTrialCountWhileTrialsAreRunning() throws Exception {
        CircuitBreakerProperties p = props(0.5, 4);
        p.setHalfOpenTrialCount(1);
        CircuitBreaker cb = new CircuitBreaker("llm", p, clock);
        cb.forceOpen("test");
        clock.advanceMillis(10_000L);

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> trial = pool.submit(() -> cb.execute(() -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return "trial";
            }));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertEquals(CircuitState.HALF_OPEN, cb.getState());

            OpenCircuitException rejected = assertThrows(OpenCircuitException.class, () -> cb.execute(() -> "second"));
            assertEquals(CircuitState.HALF_OPEN, rejected.state());
            assertEquals(Duration.ZERO, rejected.remaining());

            release.countDown();
            assertEquals("trial", trial.get(5, TimeUnit.SECONDS));
            assertEquals(CircuitState.CLOSED, cb.getState());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void halfOpen_firstTrialFailureReopens() throws Exception {
        CircuitBreaker cb = new CircuitBreaker("llm", props(0.5, 4), clock);
        cb.forceOpen("test");
        clock.advanceMillis(10_000L);

        succeedOnce(cb);
        failOnce(cb);

        assertEquals(CircuitState.OPEN, cb.getState());
        assertThrows(OpenCircuitException.class, () -> cb.execute(() -> "x"));
    }

    @Test
    void outcomesOlderThanWindow_doNotCount() throws Exception {
        CircuitBreakerProperties p = props(0.5, 4);
        p.setMonitoringWindowMs(1_000L);
        CircuitBreaker cb = new CircuitBreaker("llm", p, clock);

        failOnce(cb);
        failOnce(cb);
        failOnce(cb);
        clock.advanceMillis(1_500L);
        failOnce(cb);

        assertEquals(CircuitState.CLOSED, cb.getState());
        assertEquals(1, cb.getStats().totalRequests());
    }

    @Test
    void windowCapacity_evictsOldestOutcome() throws Exception {
        CircuitBreakerProperties p = props(1.0, 4);
        p.setWindowCapacity(4);
        CircuitBreaker cb = new CircuitBreaker("llm", p, clock);

        failOnce(cb);
        for (int i = 0; i < 4; i++) {
            succeedOnce(cb);
        }

        assertEquals(4, cb.getStats().totalRequests());
        assertEquals(0, cb.getStats().failures());
    }

    @Test
    void cancellation_isNotRecordedByDefault() {
        CircuitBreaker cb = new CircuitBreaker("llm", props(0.5, 1), clock);

        assertThrows(OperationCancelledException.class, () -> cb.execute(() -> {
            throw new OperationCancelledException("user aborted");
        }));

        assertEquals(CircuitState.CLOSED, cb.getState());
        assertEquals(0, cb.getStats().totalRequests());
    }

    @Test
    void cancellation_countsAsFailureWhenConfigured() {
        CircuitBreakerProperties p = props(0.5, 1);
        p.setCancellationCountsAsFailure(true);
        CircuitBreaker cb = new CircuitBreaker("llm", p, clock);

        assertThrows(OperationCancelledException.class, () -> cb.execute(() -> {
            throw new OperationCancelledException("user aborted");
        }));

        assertEquals(CircuitState.OPEN, cb.getState());
    }

    @Test
    void cancelledTrial_releasesItsHalfOpenSlot() throws Exception {
        CircuitBreakerProperties p = props(0.5, 4);
        p.setHalfOpenTrialCount(1);
        CircuitBreaker cb = new CircuitBreaker("llm", p, clock);
        cb.forceOpen("test");
        clock.advanceMillis(10_000L);

        assertThrows(OperationCancelledException.class, () -> cb.execute(() -> {
            throw new OperationCancelledException("aborted");
        }));
        assertEquals(CircuitState.HALF_OPEN, cb.getState());

        succeedOnce(cb);
        assertEquals(CircuitState.CLOSED, cb.getState());
    }

    @Test
    void checkedFailure_isRethrownUnchanged() {
        CircuitBreaker cb = new CircuitBreaker("llm", props(0.5, 4), clock);
        IOException io = new IOException("socket");

        IOException thrown = assertThrows(IOException.class, () -> cb.execute(() -> {
            throw io;
        }));

        assertSame(io, thrown);
        assertEquals(1, cb.getStats().failures());
    }

    @Test
    void reset_forcesClosedAndClearsHistory() {
        CircuitBreaker cb = new CircuitBreaker("llm", props(0.5, 2), clock);
        failOnce(cb);
        failOnce(cb);
        assertEquals(CircuitState.OPEN, cb.getState());

        cb.reset();

        assertEquals(CircuitState.CLOSED, cb.getState());
        assertEquals(0, cb.getStats().totalRequests());
        assertEquals(0, cb.getStats().halfOpenAdmitted());
    }

    @Test
    void listeners_seeEveryTransitionAndTheirFailuresAreSwallowed() throws Exception {
        CircuitBreaker cb = new CircuitBreaker("llm", props(0.5, 2), clock);
        List<String> seen = new ArrayList<>();
        cb.addListener((name, from, to, reason) -> {
            throw new IllegalStateException("listener bug");
        });
        cb.addListener((name, from, to, reason) -> seen.add(from + "->" + to));

        failOnce(cb);
        failOnce(cb);
        clock.advanceMillis(10_000L);
        succeedOnce(cb);
        succeedOnce(cb);

        assertThat(seen).containsExactly("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED");
    }

    @Test
    void forceOpen_whenAlreadyOpenIsNoop() {
        CircuitBreaker cb = new CircuitBreaker("llm", props(0.5, 2), clock);
        AtomicInteger transitions = new AtomicInteger();
        cb.addListener((name, from, to, reason) -> transitions.incrementAndGet());

        cb.forceOpen("one");
        long openedAt = cb.getStats().openedAtMs();
        clock.advanceMillis(1_000L);
        cb.forceOpen("two");

        assertEquals(1, transitions.get());
        assertEquals(openedAt, cb.getStats().openedAtMs());
    }

    @Test
    void scheduler_movesOpenToHalfOpenWithoutTraffic() throws Exception {
        CircuitBreakerProperties p = props(0.5, 2);
        p.setResetTimeoutMs(50L);
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try (CircuitBreaker cb = new CircuitBreaker("llm", p, clock, scheduler)) {
            cb.forceOpen("test");

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (cb.getState() != CircuitState.HALF_OPEN && System.nanoTime() < deadline) {
                Thread.sleep(10L);
            }

            assertEquals(CircuitState.HALF_OPEN, cb.getState());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void invalidProperties_areRejected() {
        CircuitBreakerProperties p = new CircuitBreakerProperties();
        p.setFailureThreshold(1.5d);

        assertThatThrownBy(() -> new CircuitBreaker("bad", p))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("failureThreshold");
    }
}
