package com.example.ai.infra.resilience.breaker;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Shared breakers by dependency name. Construct one and pass it to whoever needs shared breakers.
 */
public class CircuitBreakerRegistry implements AutoCloseable {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final List<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();
    private final CircuitBreakerProperties defaults;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    public CircuitBreakerRegistry() {
        this(new CircuitBreakerProperties(), Clock.systemUTC(), null);
    }

    public CircuitBreakerRegistry(CircuitBreakerProperties defaults, Clock clock, ScheduledExecutorService scheduler) {
        this.defaults = Objects.requireNonNull(defaults, "defaults").copy().validate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = scheduler;
    }

    /** Returns the breaker for {@code name}, creating it with the registry defaults. */
    public CircuitBreaker get(String name) {
        return get(name, defaults);
    }

    /**
     * Returns the breaker for {@code name}, creating it with {@code props} when absent. An existing
     * breaker keeps its original configuration.
     */
    public CircuitBreaker get(String name, CircuitBreakerProperties props) {
        Objects.requireNonNull(name, "name");
        return breakers.computeIfAbsent(name, n -> {
            CircuitBreaker cb = new CircuitBreaker(n, props == null ? defaults : props, clock, scheduler);
            listeners.forEach(cb::addListener);
            return cb;
        });
    }

    public boolean has(String name) {
        return breakers.containsKey(name);
    }

    /** Removes and closes the breaker; callers still holding it may keep using it. */
    public boolean remove(String name) {
        CircuitBreaker cb = breakers.remove(name);
        if (cb == null) {
            return false;
        }
        cb.close();
        return true;
    }

    public Collection<CircuitBreaker> getAll() {
        return new ArrayList<>(breakers.values());
    }

    /** Stats of every breaker, ordered by name. */
    public Map<String, CircuitBreakerStats> getAllStats() {
        Map<String, CircuitBreakerStats> out = new TreeMap<>();
        breakers.forEach((n, cb) -> out.put(n, cb.getStats()));
        return out;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    /** Attaches {@code listener} to every current and future breaker. */
    public void addListener(CircuitStateListener listener) {
        if (listener == null) {
            return;
        }
        listeners.add(listener);
        breakers.values().forEach(cb -> cb.addListener(listener));
    }

    public int size() {
        return breakers.size();
    }

    @Override
    public void close() {
        breakers.values().forEach(CircuitBreaker::close);
        breakers.clear();
    }
}
