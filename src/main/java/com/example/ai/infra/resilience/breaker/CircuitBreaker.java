package com.example.ai.infra.resilience.breaker;

import com.example.ai.infra.resilience.OpenCircuitException;
import com.example.ai.infra.resilience.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Failure-rate circuit breaker for a single dependency.
 *
 * <ul>
 * <li>CLOSED → OPEN once the monitoring window holds at least {@code requestThreshold} outcomes
 * and the failure ratio reaches {@code failureThreshold}.</li>
 * <li>OPEN → HALF_OPEN after the reset timeout, by timer when a scheduler was supplied,
 * otherwise lazily on the next {@link #execute(Callable)}.</li>
 * <li>HALF_OPEN → CLOSED when every admitted trial succeeded; → OPEN on the first trial failure.</li>
 * </ul>
 *
 * <p>State mutations happen under the instance monitor, never while the operation runs. Two callers
 * racing the same breaker may both see the pre-transition state once.</p>
 */
public class CircuitBreaker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerProperties props;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final OutcomeWindow window;
    private final List<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();

    // guarded by this
    private CircuitState state = CircuitState.CLOSED;
    private long episode;
    private long openedAtMs;
    private long stateSinceMs;
    private int halfOpenAdmitted;
    private int halfOpenSuccesses;
    private double failureThreshold;
    private long resetTimeoutMs;
    private ScheduledFuture<?> halfOpenTimer;
    private long timerSeq;
    private final List<Transition> pending = new ArrayList<>(2);

    public CircuitBreaker(String name, CircuitBreakerProperties props) {
        this(name, props, Clock.systemUTC(), null);
    }

    public CircuitBreaker(String name, CircuitBreakerProperties props, Clock clock) {
        this(name, props, clock, null);
    }

    /**
     * @param scheduler optional; when present the OPEN → HALF_OPEN transition fires on its own
     */
    public CircuitBreaker(String name, CircuitBreakerProperties props, Clock clock, ScheduledExecutorService scheduler) {
        this.name = Objects.requireNonNull(name, "name");
        this.props = Objects.requireNonNull(props, "props").copy().validate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = scheduler;
        this.window = new OutcomeWindow(this.props.getMonitoringWindowMs(), this.props.getWindowCapacity());
        this.failureThreshold = this.props.getFailureThreshold();
        this.resetTimeoutMs = this.props.getResetTimeoutMs();
        this.stateSinceMs = clock.millis();
    }

    public String getName() {
        return name;
    }

    /** Effective configuration (a private copy; mutating it has no effect). */
    public CircuitBreakerProperties getProperties() {
        return props.copy();
    }

    public void addListener(CircuitStateListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(CircuitStateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Runs {@code operation} unless the breaker refuses it.
     *
     * @return the operation result, unchanged
     * @throws OpenCircuitException when OPEN within the reset timeout, or HALF_OPEN with no trial slot left;
     *                              the operation is not invoked and nothing is recorded
     * @throws Exception            whatever the operation threw, after recording it
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation");
        Admission admission;
        try {
            admission = admit();
        } finally {
            fireTransitions();
        }

        long started = System.nanoTime();
        try {
            T result = operation.call();
            onSuccess(admission, elapsedMs(started));
            return result;
        } catch (Exception e) {
            onFailure(admission, elapsedMs(started), e);
            throw e;
        } catch (Error err) {
            onFailure(admission, elapsedMs(started), err);
            throw err;
        }
    }

    private synchronized Admission admit() {
        long now = clock.millis();
        if (state == CircuitState.OPEN) {
            long remaining = openedAtMs + resetTimeoutMs - now;
            if (remaining > 0) {
                throw new OpenCircuitException(name, Duration.ofMillis(remaining), CircuitState.OPEN);
            }
            transitionTo(CircuitState.HALF_OPEN, "Reset timeout expired, testing recovery", now);
        }
        if (state == CircuitState.HALF_OPEN) {
            if (halfOpenAdmitted >= props.getHalfOpenTrialCount()) {
                throw new OpenCircuitException(name, Duration.ZERO, CircuitState.HALF_OPEN);
            }
            halfOpenAdmitted++;
            return new Admission(true, episode);
        }
        return new Admission(false, episode);
    }

    private void onSuccess(Admission admission, long durationMs) {
        synchronized (this) {
            long now = clock.millis();
            window.prune(now);
            window.add(new RequestOutcome(now, true, durationMs));
            if (state == CircuitState.HALF_OPEN) {
                if (admission.trial() && admission.episode() == episode) {
                    halfOpenSuccesses++;
                    if (halfOpenSuccesses >= props.getHalfOpenTrialCount()) {
                        transitionTo(CircuitState.CLOSED,
                                "All " + halfOpenSuccesses + " trial requests succeeded", now);
                    }
                }
            } else if (state == CircuitState.CLOSED) {
                evaluateTrip(now);
            }
        }
        fireTransitions();
    }

    private void onFailure(Admission admission, long durationMs, Throwable error) {
        synchronized (this) {
            long now = clock.millis();
            if (OperationCancelledException.isCancellation(error) && !props.isCancellationCountsAsFailure()) {
                if (state == CircuitState.HALF_OPEN && admission.trial() && admission.episode() == episode) {
                    halfOpenAdmitted = Math.max(0, halfOpenAdmitted - 1);
                }
                log.debug("[CircuitBreaker] cancellation not recorded name={}", name);
                return;
            }
            window.prune(now);
            window.add(new RequestOutcome(now, false, durationMs));
            if (state == CircuitState.HALF_OPEN) {
                if (admission.trial() && admission.episode() == episode) {
                    transitionTo(CircuitState.OPEN, "Trial request failed, reopening circuit", now);
                }
            } else if (state == CircuitState.CLOSED) {
                evaluateTrip(now);
            }
        }
        fireTransitions();
    }

    // caller holds the monitor and has pruned the window
    private void evaluateTrip(long now) {
        int count = window.size();
        if (count < props.getRequestThreshold()) {
            return;
        }
        double rate = window.failureRate();
        if (rate >= failureThreshold) {
            transitionTo(CircuitState.OPEN, String.format(Locale.ROOT,
                    "Failure rate %.1f%% exceeds threshold %.1f%% over %d requests",
                    rate * 100.0d, failureThreshold * 100.0d, count), now);
        }
    }

    /**
     * Current state. Never transitions as a side effect, so an expired OPEN still reads OPEN
     * until the next call or timer moves it.
     */
    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerStats getStats() {
        long now = clock.millis();
        window.prune(now);
        double trialRate = 0.0d;
        if (state == CircuitState.HALF_OPEN) {
            int seen = 0;
            int ok = 0;
            for (RequestOutcome o : window.snapshot()) {
                if (o.timestampMs() >= stateSinceMs) {
                    seen++;
                    if (o.success()) {
                        ok++;
                    }
                }
            }
            trialRate = seen == 0 ? 0.0d : (double) ok / seen;
        }
        return new CircuitBreakerStats(
                name,
                state,
                window.failureRate(),
                window.size(),
                window.failures(),
                window.successes(),
                openedAtMs,
                stateSinceMs,
                halfOpenAdmitted,
                halfOpenSuccesses,
                trialRate,
                failureThreshold,
                resetTimeoutMs,
                window.averageDurationMs());
    }

    /** Forces CLOSED and clears history and trial counters. */
    public void reset() {
        synchronized (this) {
            transitionTo(CircuitState.CLOSED, "Manual reset", clock.millis());
            window.clear();
            halfOpenAdmitted = 0;
            halfOpenSuccesses = 0;
        }
        fireTransitions();
    }

    /** Opens immediately regardless of history. No-op when already OPEN. */
    public void forceOpen(String reason) {
        synchronized (this) {
            transitionTo(CircuitState.OPEN, (reason == null || reason.isBlank()) ? "Manually forced open" : reason,
                    clock.millis());
        }
        fireTransitions();
    }

    /**
     * Adjusts the live failure threshold and reset timeout. Only the adaptive wrapper calls this; the
     * configured values stay untouched in {@link #getProperties()}. A new timeout applies to the current
     * OPEN period too, measured from when it opened.
     */
    synchronized void tune(double newFailureThreshold, long newResetTimeoutMs) {
        if (newFailureThreshold > 0.0d && newFailureThreshold <= 1.0d) {
            this.failureThreshold = newFailureThreshold;
        }
        if (newResetTimeoutMs > 0) {
            applyResetTimeout(newResetTimeoutMs);
        }
    }

    // caller holds the monitor
    private void applyResetTimeout(long newResetTimeoutMs) {
        if (newResetTimeoutMs == resetTimeoutMs) {
            return;
        }
        resetTimeoutMs = newResetTimeoutMs;
        if (state == CircuitState.OPEN && halfOpenTimer != null) {
            cancelTimer();
            long delay = Math.max(0L, openedAtMs + resetTimeoutMs - clock.millis());
            scheduleHalfOpen(episode, delay);
            log.debug("[CircuitBreaker] half-open timer moved name={} resetTimeoutMs={} delayMs={}",
                    name, resetTimeoutMs, delay);
        }
    }

    synchronized List<RequestOutcome> outcomes() {
        window.prune(clock.millis());
        return window.snapshot();
    }

    Clock clock() {
        return clock;
    }

    // caller holds the monitor
    private void transitionTo(CircuitState next, String reason, long now) {
        CircuitState prev = state;
        if (prev == next) {
            return;
        }
        state = next;
        stateSinceMs = now;
        episode++;
        cancelTimer();

        switch (next) {
            case OPEN:
                openedAtMs = now;
                halfOpenAdmitted = 0;
                halfOpenSuccesses = 0;
                scheduleHalfOpen(episode, resetTimeoutMs);
                log.warn("[CircuitBreaker] OPEN name={} from={} reason={} resetTimeoutMs={}",
                        name, prev, reason, resetTimeoutMs);
                break;
            case HALF_OPEN:
                halfOpenAdmitted = 0;
                halfOpenSuccesses = 0;
                log.info("[CircuitBreaker] HALF_OPEN trial start: name={} reason={}", name, reason);
                break;
            case CLOSED:
            default:
                openedAtMs = 0L;
                halfOpenAdmitted = 0;
                halfOpenSuccesses = 0;
                window.clear();
                log.info("[CircuitBreaker] CLOSED name={} from={} reason={}", name, prev, reason);
                break;
        }
        pending.add(new Transition(prev, next, reason));
    }

    private void scheduleHalfOpen(long openEpisode, long delayMs) {
        if (scheduler == null) {
            return;
        }
        long seq = ++timerSeq;
        try {
            halfOpenTimer = scheduler.schedule(() -> onResetTimer(openEpisode, seq), delayMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            // rejected (scheduler shut down): the lazy path in admit() still applies
            log.debug("[CircuitBreaker] half-open timer not scheduled name={} err={}", name, e.toString());
        }
    }

    private void onResetTimer(long openEpisode, long seq) {
        synchronized (this) {
            // a rescheduled timer supersedes one that already started running
            if (state != CircuitState.OPEN || episode != openEpisode || seq != timerSeq) {
                return;
            }
            halfOpenTimer = null;
            transitionTo(CircuitState.HALF_OPEN, "Reset timeout expired", clock.millis());
        }
        fireTransitions();
    }

    private void cancelTimer() {
        if (halfOpenTimer != null) {
            halfOpenTimer.cancel(false);
            halfOpenTimer = null;
        }
    }

    private void fireTransitions() {
        List<Transition> batch;
        synchronized (this) {
            if (pending.isEmpty()) {
                return;
            }
            batch = new ArrayList<>(pending);
            pending.clear();
        }
        for (Transition t : batch) {
            for (CircuitStateListener l : listeners) {
                try {
                    l.onStateChange(name, t.from(), t.to(), t.reason());
                } catch (Throwable ex) {
                    log.warn("[CircuitBreaker] state listener failed name={} err={}", name, ex.toString());
                }
            }
        }
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    @Override
    public void close() {
        synchronized (this) {
            cancelTimer();
        }
    }

    @Override
    public String toString() {
        return "CircuitBreaker[" + name + ", " + getState() + "]";
    }

    private record Admission(boolean trial, long episode) {
    }

    private record Transition(CircuitState from, CircuitState to, String reason) {
    }
}
