package com.example.ai.config;

import com.example.ai.infra.resilience.breaker.CircuitBreaker;
import com.example.ai.infra.resilience.breaker.CircuitBreakerRegistry;
import com.example.ai.infra.resilience.breaker.CircuitState;
import com.example.ai.infra.resilience.recovery.RecoveryEvent;
import com.example.ai.infra.resilience.recovery.RecoveryEventListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer view of the shared breakers and the recovery event stream.
 *
 * <p>Tags stay low-cardinality: breaker name, target state, event type, service name.</p>
 */
public final class ResilienceMeterBinder implements MeterBinder, RecoveryEventListener {

    private final CircuitBreakerRegistry breakers;
    private final String prefix;
    private final Set<String> gauged = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private volatile MeterRegistry registry; // null until bound

    public ResilienceMeterBinder(CircuitBreakerRegistry breakers, String prefix) {
        this.breakers = breakers;
        this.prefix = (prefix == null || prefix.isBlank()) ? "ai.resilience" : prefix.trim();
    }

    @Override
    public synchronized void bindTo(MeterRegistry meterRegistry) {
        if (this.registry == meterRegistry) {
            return;
        }
        this.registry = meterRegistry;
        breakers.getAll().forEach(this::gauge);
        breakers.addListener((name, from, to, reason) -> {
            if (breakers.has(name)) {
                gauge(breakers.get(name));
            }
            count(prefix + ".breaker.transitions", "name", name, "to", to.name());
        });
    }

    private void gauge(CircuitBreaker cb) {
        MeterRegistry r = registry;
        if (r == null || !gauged.add(cb.getName())) {
            return;
        }
        String name = safeTag(cb.getName());
        Gauge.builder(prefix + ".breaker.state", cb, b -> stateCode(b.getState()))
                .description("0=closed, 1=half-open, 2=open")
                .tag("name", name)
                .register(r);
        Gauge.builder(prefix + ".breaker.failure.rate", cb, b -> b.getStats().failureRate())
                .tag("name", name)
                .register(r);
    }

    @Override
    public void onEvent(RecoveryEvent event) {
        if (event == null) {
            return;
        }
        count(prefix + ".recovery.events", "type", event.type().code(), "service", event.service());
    }

    private void count(String meter, String k1, String v1, String k2, String v2) {
        MeterRegistry r = registry;
        if (r == null) {
            return;
        }
        String t1 = safeTag(v1);
        String t2 = safeTag(v2);
        counters.computeIfAbsent(meter + "|" + t1 + "|" + t2,
                k -> Counter.builder(meter).tag(k1, t1).tag(k2, t2).register(r)).increment();
    }

    private static double stateCode(CircuitState state) {
        return state.code();
    }

    private static String safeTag(String raw) {
        if (raw == null) {
            return "none";
        }
        String s = raw.trim();
        if (s.isEmpty()) {
            return "none";
        }
        if (s.length() > 64) {
            s = s.substring(0, 64);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
