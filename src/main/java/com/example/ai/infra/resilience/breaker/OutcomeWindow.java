package com.example.ai.infra.resilience.breaker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Time-ordered outcome buffer with two eviction rules: entries older than the monitoring window are
 * pruned from the head, and the oldest entry is dropped once {@code capacity} is reached.
 *
 * <p>Not thread-safe; the owning breaker guards every access.</p>
 */
final class OutcomeWindow {

    private final Deque<RequestOutcome> outcomes = new ArrayDeque<>();
    private final int capacity;
    private long windowMs;
    private int failures;

    OutcomeWindow(long windowMs, int capacity) {
        this.windowMs = windowMs;
        this.capacity = Math.max(1, capacity);
    }

    void add(RequestOutcome outcome) {
        while (outcomes.size() >= capacity) {
            evictHead();
        }
        outcomes.addLast(outcome);
        if (!outcome.success()) {
            failures++;
        }
    }

    /** Drops every outcome older than {@code nowMs - windowMs}. */
    void prune(long nowMs) {
        long cutoff = nowMs - windowMs;
        while (!outcomes.isEmpty() && outcomes.peekFirst().timestampMs() < cutoff) {
            evictHead();
        }
    }

    private void evictHead() {
        RequestOutcome head = outcomes.pollFirst();
        if (head != null && !head.success()) {
            failures--;
        }
    }

    void clear() {
        outcomes.clear();
        failures = 0;
    }

    int size() {
        return outcomes.size();
    }

    int failures() {
        return failures;
    }

    int successes() {
        return outcomes.size() - failures;
    }

    double failureRate() {
        return outcomes.isEmpty() ? 0.0d : (double) failures / outcomes.size();
    }

    double averageDurationMs() {
        if (outcomes.isEmpty()) {
            return 0.0d;
        }
        long total = 0L;
        for (RequestOutcome o : outcomes) {
            total += o.durationMs();
        }
        return (double) total / outcomes.size();
    }

    long windowMs() {
        return windowMs;
    }

    List<RequestOutcome> snapshot() {
        return new ArrayList<>(outcomes);
    }
}
