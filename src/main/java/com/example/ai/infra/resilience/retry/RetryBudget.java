package com.example.ai.infra.resilience.retry;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fixed-bucket retry budget shared by every caller of one policy. The bucket of {@code now} starts at
 * {@code now - now % windowMs}; buckets older than one window are discarded.
 */
public class RetryBudget {

    private final int budget;
    private final long windowMs;
    private final TreeMap<Long, Integer> buckets = new TreeMap<>();

    public RetryBudget(int budget, long windowMs) {
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be > 0: " + windowMs);
        }
        this.budget = Math.max(0, budget);
        this.windowMs = windowMs;
    }

    public int getBudget() {
        return budget;
    }

    public long getWindowMs() {
        return windowMs;
    }

    public synchronized boolean hasCapacity(long nowMs) {
        cleanup(nowMs);
        return buckets.getOrDefault(bucketStart(nowMs), 0) < budget;
    }

    public synchronized void consume(long nowMs) {
        cleanup(nowMs);
        buckets.merge(bucketStart(nowMs), 1, Integer::sum);
    }

    /** Units consumed in the bucket of {@code nowMs}. */
    public synchronized int used(long nowMs) {
        cleanup(nowMs);
        return buckets.getOrDefault(bucketStart(nowMs), 0);
    }

    public synchronized void reset() {
        buckets.clear();
    }

    private long bucketStart(long nowMs) {
        return nowMs - Math.floorMod(nowMs, windowMs);
    }

    private void cleanup(long nowMs) {
        long cutoff = nowMs - windowMs;
        Iterator<Map.Entry<Long, Integer>> it = buckets.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getKey() < cutoff) {
                it.remove();
            } else {
                break;
            }
        }
    }
}
