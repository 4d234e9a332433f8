package com.example.ai.infra.resilience.degrade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-process {@link DegradationManager}.
 */
public class InMemoryDegradationManager implements DegradationManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDegradationManager.class);

    private final Map<String, DegradationLevel> levels = new ConcurrentHashMap<>();

    @Override
    public void degrade(String name, DegradationLevel level, String reason) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(level, "level");
        if (level == DegradationLevel.FULL) {
            recover(name);
            return;
        }
        DegradationLevel prev = levels.put(name, level);
        if (prev != level) {
            log.warn("[Degradation] degraded name={} level={} prev={} reason={}",
                    name, level, prev == null ? DegradationLevel.FULL : prev, reason);
        }
    }

    @Override
    public void recover(String name) {
        if (name == null) {
            return;
        }
        DegradationLevel prev = levels.remove(name);
        if (prev != null) {
            log.info("[Degradation] recovered name={} prev={}", name, prev);
        }
    }

    @Override
    public boolean isDegraded(String name) {
        return name != null && levels.containsKey(name);
    }

    @Override
    public DegradationLevel getLevel(String name) {
        if (name == null) {
            return DegradationLevel.FULL;
        }
        return levels.getOrDefault(name, DegradationLevel.FULL);
    }

    /** Degraded names only, ordered by name. */
    public Map<String, DegradationLevel> snapshot() {
        return new TreeMap<>(levels);
    }
}
