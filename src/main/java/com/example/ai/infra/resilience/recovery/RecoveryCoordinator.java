package com.example.ai.infra.resilience.recovery;

import com.example.ai.infra.resilience.breaker.AdaptiveCircuitBreaker;
import com.example.ai.infra.resilience.breaker.CircuitBreaker;
import com.example.ai.infra.resilience.breaker.CircuitBreakerStats;
import com.example.ai.infra.resilience.breaker.CircuitState;
import com.example.ai.infra.resilience.degrade.DegradationManager;
import com.example.ai.infra.resilience.retry.AdvancedRetryPolicy;
import com.example.ai.infra.resilience.retry.RetryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Brings failed or degraded services back to healthy, in dependency order and with bounded concurrency.
 *
 * <p>Never executes business operations; it inspects and resets the breakers and retry policies it was
 * given and validates health through each service's {@link HealthCheck}. Recovery failures are reported
 * through status and events, never thrown.</p>
 */
public class RecoveryCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private final RecoveryCoordinatorOptions options;
    private final DegradationManager degradationManager;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final List<RecoveryEventListener> listeners = new CopyOnWriteArrayList<>();

    // guarded by this
    private final Map<String, ServiceConfig> services = new LinkedHashMap<>();
    private final Map<String, MutableStatus> statuses = new HashMap<>();
    private final Set<String> activeRecoveries = new HashSet<>();
    private final List<RecoveryEvent> events = new ArrayList<>();
    private ScheduledFuture<?> sweepTask;
    private ScheduledExecutorService ownedScheduler;

    public RecoveryCoordinator() {
        this(new RecoveryCoordinatorOptions(), null);
    }

    public RecoveryCoordinator(RecoveryCoordinatorOptions options, DegradationManager degradationManager) {
        this(options, degradationManager, Clock.systemUTC(), null);
    }

    /**
     * @param scheduler runs the automatic sweep; when null a single daemon thread is created on
     *                  {@link #start()} and shut down on {@link #close()}
     */
    public RecoveryCoordinator(RecoveryCoordinatorOptions options, DegradationManager degradationManager,
                               Clock clock, ScheduledExecutorService scheduler) {
        this.options = Objects.requireNonNull(options, "options").copy().validate();
        this.degradationManager = degradationManager;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = scheduler;
    }

    public void addListener(RecoveryEventListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(RecoveryEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Registers a service as HEALTHY. Dependencies may name services registered later.
     *
     * @throws IllegalArgumentException when the name is blank or already registered
     */
    public synchronized void registerService(ServiceConfig config) {
        Objects.requireNonNull(config, "config");
        String name = config.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("service name must not be blank");
        }
        if (services.containsKey(name)) {
            throw new IllegalArgumentException("Service already registered: " + name);
        }
        services.put(name, config);
        statuses.put(name, new MutableStatus(name, dependenciesOf(config)));
        log.debug("[RecoveryCoordinator] registered {}", config);
    }

    public synchronized boolean unregisterService(String name) {
        activeRecoveries.remove(name);
        statuses.remove(name);
        return services.remove(name) != null;
    }

    public synchronized boolean isRegistered(String name) {
        return services.containsKey(name);
    }

    /** Reports a health drop observed by business code. */
    public void markDegraded(String name, String details) {
        markState(name, RecoveryState.DEGRADED, RecoveryEventType.DEGRADED, details);
    }

    /** Reports an outage observed by business code. */
    public void markFailed(String name, String details) {
        markState(name, RecoveryState.FAILED, RecoveryEventType.FAILED, details);
    }

    private void markState(String name, RecoveryState state, RecoveryEventType type, String details) {
        RecoveryEvent event;
        synchronized (this) {
            MutableStatus st = requireStatus(name);
            long now = clock.millis();
            st.state = state;
            if (state == RecoveryState.FAILED) {
                st.lastFailureMs = now;
            }
            event = append(RecoveryEvent.of(type, name, now, details));
        }
        publish(event);
    }

    /**
     * Attempts to recover {@code name}.
     *
     * @return true when the service is HEALTHY afterwards; false when the attempt was refused (already in
     * flight, concurrency cap reached, attempts exhausted) or did not succeed
     * @throws IllegalArgumentException when {@code name} was never registered
     */
    public boolean recoverService(String name) {
        ServiceConfig cfg;
        MutableStatus st;
        RecoveryEvent refusal = null;
        RecoveryEvent started;
        synchronized (this) {
            cfg = services.get(name);
            st = statuses.get(name);
            if (cfg == null || st == null) {
                throw new IllegalArgumentException("Service not registered: " + name);
            }
            if (activeRecoveries.contains(name)) {
                return false;
            }
            if (activeRecoveries.size() >= options.getMaxConcurrentRecoveries()) {
                log.debug("[RecoveryCoordinator] concurrency cap reached, skip {} active={}", name, activeRecoveries);
                return false;
            }
            if (st.attemptCount >= cfg.getMaxRecoveryAttempts()) {
                refusal = append(RecoveryEvent.of(RecoveryEventType.FAILED, name, clock.millis(),
                        "Maximum recovery attempts exceeded"));
                started = null;
            } else {
                activeRecoveries.add(name);
                long now = clock.millis();
                st.state = RecoveryState.RECOVERING;
                st.attemptCount++;
                st.lastAttemptMs = now;
                started = append(RecoveryEvent.of(RecoveryEventType.STARTED, name, now, null));
            }
        }
        if (refusal != null) {
            log.warn("[RecoveryCoordinator] {} refused: maximum recovery attempts ({}) exceeded",
                    name, cfg.getMaxRecoveryAttempts());
            publish(refusal);
            return false;
        }
        publish(started);
        log.info("[RecoveryCoordinator] recovery started service={} strategy={} attempt={}",
                name, cfg.getStrategy(), st.attemptCount);

        try {
            boolean depsHealthy = checkDependencies(cfg);
            synchronized (this) {
                st.dependenciesHealthy = depsHealthy;
            }
            if (!depsHealthy && cfg.getStrategy() == RecoveryStrategy.COORDINATED) {
                return onFailure(cfg, st, "Dependencies not healthy");
            }
            if (executeRecovery(cfg)) {
                onSuccess(cfg, st);
                return true;
            }
            return onFailure(cfg, st, "Recovery validation failed");
        } catch (Exception e) {
            return onFailure(cfg, st, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } finally {
            synchronized (this) {
                activeRecoveries.remove(name);
            }
        }
    }

    private boolean executeRecovery(ServiceConfig cfg) throws Exception {
        switch (cfg.getStrategy()) {
            case IMMEDIATE:
                return immediateRecovery(cfg);
            case COORDINATED:
                return coordinatedRecovery(cfg);
            case MANUAL:
                return false;
            case GRADUAL:
            default:
                return gradualRecovery(cfg);
        }
    }

    private boolean immediateRecovery(ServiceConfig cfg) throws Exception {
        CircuitBreaker breaker = cfg.breaker();
        if (breaker != null) {
            breaker.reset();
        }
        return cfg.getHealthCheck() == null || cfg.getHealthCheck().check();
    }

    private boolean gradualRecovery(ServiceConfig cfg) throws Exception {
        CircuitBreaker breaker = cfg.breaker();
        if (breaker != null) {
            CircuitState state = breaker.getState();
            if (state == CircuitState.OPEN) {
                // its own reset timeout moves it to half-open
                return false;
            }
            if (state == CircuitState.HALF_OPEN) {
                CircuitBreakerStats stats = breaker.getStats();
                return stats.trialSuccessRate() >= breaker.getProperties().getHalfOpenSuccessRate();
            }
        }
        if (cfg.getHealthCheck() == null) {
            return true;
        }
        if (cfg.getHealthCheck().check()) {
            if (breaker != null) {
                breaker.reset();
            }
            return true;
        }
        return false;
    }

    private boolean coordinatedRecovery(ServiceConfig cfg) throws Exception {
        if (!checkDependencies(cfg)) {
            return false;
        }
        return gradualRecovery(cfg);
    }

    /** Every direct dependency is registered, HEALTHY, and its breaker (if any) is not OPEN. */
    private boolean checkDependencies(ServiceConfig cfg) {
        Set<String> deps = dependenciesOf(cfg);
        if (deps.isEmpty()) {
            return true;
        }
        List<CircuitBreaker> depBreakers = new ArrayList<>();
        synchronized (this) {
            for (String dep : deps) {
                MutableStatus ds = statuses.get(dep);
                if (ds == null || ds.state != RecoveryState.HEALTHY) {
                    return false;
                }
                CircuitBreaker b = services.get(dep).breaker();
                if (b != null) {
                    depBreakers.add(b);
                }
            }
        }
        for (CircuitBreaker b : depBreakers) {
            if (b.getState() == CircuitState.OPEN) {
                return false;
            }
        }
        return true;
    }

    private void onSuccess(ServiceConfig cfg, MutableStatus st) {
        synchronized (this) {
            st.state = RecoveryState.HEALTHY;
            st.lastSuccessMs = clock.millis();
            st.attemptCount = 0;
        }
        CircuitBreaker breaker = cfg.breaker();
        if (breaker != null) {
            breaker.reset();
        }
        if (cfg.getAdaptiveBreaker() != null) {
            cfg.getAdaptiveBreaker().resetMetrics();
        }
        if (cfg.getRetryPolicy() != null) {
            cfg.getRetryPolicy().reset();
        }
        if (degradationManager != null) {
            try {
                degradationManager.recover(cfg.getName());
            } catch (RuntimeException e) {
                log.warn("[RecoveryCoordinator] degradation recover failed service={} err={}",
                        cfg.getName(), e.toString());
            }
        }
        Map<String, Object> metrics = serviceMetrics(cfg);
        RecoveryEvent event;
        synchronized (this) {
            event = append(new RecoveryEvent(RecoveryEventType.SUCCEEDED, cfg.getName(), clock.millis(), null, metrics));
        }
        log.info("[RecoveryCoordinator] recovery succeeded service={}", cfg.getName());
        publish(event);
    }

    private boolean onFailure(ServiceConfig cfg, MutableStatus st, String reason) {
        RecoveryEvent event;
        synchronized (this) {
            long now = clock.millis();
            st.state = RecoveryState.FAILED;
            st.lastFailureMs = now;
            event = append(RecoveryEvent.of(RecoveryEventType.FAILED, cfg.getName(), now, reason));
        }
        log.warn("[RecoveryCoordinator] recovery failed service={} attempt={}/{} reason={}",
                cfg.getName(), st.attemptCount, cfg.getMaxRecoveryAttempts(), reason);
        publish(event);
        return false;
    }

    private Map<String, Object> serviceMetrics(ServiceConfig cfg) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        CircuitBreaker breaker = cfg.breaker();
        if (breaker != null) {
            CircuitBreakerStats stats = breaker.getStats();
            Map<String, Object> circuit = new LinkedHashMap<>();
            circuit.put("state", stats.state().name());
            circuit.put("failureRate", stats.failureRate());
            AdaptiveCircuitBreaker adaptive = cfg.getAdaptiveBreaker();
            if (adaptive != null) {
                circuit.put("healthScore", adaptive.getHealthMetrics().healthScore());
            }
            metrics.put("circuit", circuit);
        }
        AdvancedRetryPolicy retry = cfg.getRetryPolicy();
        if (retry != null) {
            RetryMetrics rm = retry.getMetrics();
            Map<String, Object> r = new LinkedHashMap<>();
            r.put("successRate", rm.successRate());
            r.put("averageDelayMs", rm.averageDelayMs());
            metrics.put("retry", r);
        }
        return metrics;
    }

    /** Snapshot with live circuit state and health score; null when not registered. */
    public RecoveryStatus getStatus(String name) {
        ServiceConfig cfg;
        MutableStatus st;
        RecoveryStatus base;
        synchronized (this) {
            cfg = services.get(name);
            st = statuses.get(name);
            if (cfg == null || st == null) {
                return null;
            }
            base = st.snapshot(null, null);
        }
        CircuitBreaker breaker = cfg.breaker();
        CircuitState circuit = breaker == null ? null : breaker.getState();
        Integer score = cfg.getAdaptiveBreaker() == null ? null : cfg.getAdaptiveBreaker().getHealthMetrics().healthScore();
        return new RecoveryStatus(base.service(), base.state(), base.attemptCount(), base.lastAttemptMs(),
                base.lastSuccessMs(), base.lastFailureMs(), base.dependencies(), base.dependenciesHealthy(),
                circuit, score);
    }

    /** Every registered service, ordered by name. */
    public Map<String, RecoveryStatus> getAllStatus() {
        List<String> names;
        synchronized (this) {
            names = new ArrayList<>(services.keySet());
        }
        Map<String, RecoveryStatus> out = new TreeMap<>();
        for (String n : names) {
            RecoveryStatus s = getStatus(n);
            if (s != null) {
                out.put(n, s);
            }
        }
        return out;
    }

    /** The newest {@code limit} events, oldest first. */
    public synchronized List<RecoveryEvent> getHistory(int limit) {
        int n = Math.max(0, Math.min(limit, events.size()));
        return List.copyOf(events.subList(events.size() - n, events.size()));
    }

    public List<RecoveryEvent> getHistory() {
        return getHistory(100);
    }

    public synchronized int getActiveRecoveries() {
        return activeRecoveries.size();
    }

    /**
     * One pass of the automatic sweep: by descending priority, recovers every non-manual service whose
     * breaker is OPEN or whose status is FAILED or DEGRADED.
     */
    public void checkRecoveries() {
        List<ServiceConfig> ordered;
        synchronized (this) {
            ordered = new ArrayList<>(services.values());
        }
        ordered.sort(Comparator.comparingInt(ServiceConfig::getPriority).reversed());
        for (ServiceConfig cfg : ordered) {
            if (cfg.getStrategy() == RecoveryStrategy.MANUAL) {
                continue;
            }
            RecoveryState state;
            synchronized (this) {
                MutableStatus st = statuses.get(cfg.getName());
                if (st == null) {
                    continue;
                }
                state = st.state;
            }
            CircuitBreaker breaker = cfg.breaker();
            boolean needsRecovery = state == RecoveryState.FAILED
                    || state == RecoveryState.DEGRADED
                    || (breaker != null && breaker.getState() == CircuitState.OPEN);
            if (!needsRecovery) {
                continue;
            }
            try {
                recoverService(cfg.getName());
            } catch (IllegalArgumentException unregistered) {
                log.debug("[RecoveryCoordinator] {} unregistered during sweep", cfg.getName());
            }
        }
    }

    /** Schedules the sweep when {@code autoRecover} is enabled. Idempotent. */
    public synchronized void start() {
        if (!options.isAutoRecover() || sweepTask != null) {
            return;
        }
        ScheduledExecutorService exec = scheduler != null ? scheduler : ownScheduler();
        long interval = options.getCheckIntervalMs();
        sweepTask = exec.scheduleWithFixedDelay(this::sweepSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("[RecoveryCoordinator] auto-recovery started intervalMs={}", interval);
    }

    private ScheduledExecutorService ownScheduler() {
        if (ownedScheduler == null) {
            ownedScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "recovery-sweep");
                t.setDaemon(true);
                return t;
            });
        }
        return ownedScheduler;
    }

    private void sweepSafely() {
        try {
            checkRecoveries();
        } catch (RuntimeException e) {
            log.warn("[RecoveryCoordinator] sweep failed err={}", e.toString());
        }
    }

    /** Stops the sweep. Registered services and history are kept. */
    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
    }

    @Override
    public synchronized void close() {
        stop();
        if (ownedScheduler != null) {
            ownedScheduler.shutdownNow();
            ownedScheduler = null;
        }
    }

    // caller holds the monitor
    private RecoveryEvent append(RecoveryEvent event) {
        events.add(event);
        if (events.size() > options.getHistoryCapacity()) {
            events.subList(0, events.size() - options.getHistoryRetain()).clear();
        }
        return event;
    }

    private void publish(RecoveryEvent event) {
        for (RecoveryEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (Throwable ex) {
                log.warn("[RecoveryCoordinator] event listener failed type={} service={} err={}",
                        event.type(), event.service(), ex.toString());
            }
        }
    }

    private MutableStatus requireStatus(String name) {
        MutableStatus st = statuses.get(name);
        if (st == null) {
            throw new IllegalArgumentException("Service not registered: " + name);
        }
        return st;
    }

    private static Set<String> dependenciesOf(ServiceConfig cfg) {
        return cfg.getDependencies() == null ? Set.of() : new LinkedHashSet<>(cfg.getDependencies());
    }

    private static final class MutableStatus {
        final String service;
        final Set<String> dependencies;
        RecoveryState state = RecoveryState.HEALTHY;
        int attemptCount;
        long lastAttemptMs;
        long lastSuccessMs;
        long lastFailureMs;
        boolean dependenciesHealthy = true;

        MutableStatus(String service, Set<String> dependencies) {
            this.service = service;
            this.dependencies = Set.copyOf(dependencies);
        }

        RecoveryStatus snapshot(CircuitState circuit, Integer healthScore) {
            return new RecoveryStatus(service, state, attemptCount, lastAttemptMs, lastSuccessMs, lastFailureMs,
                    dependencies, dependenciesHealthy, circuit, healthScore);
        }
    }
}
