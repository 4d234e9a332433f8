package com.example.ai.config;

import com.example.ai.infra.resilience.breaker.CircuitBreakerProperties;
import com.example.ai.infra.resilience.recovery.RecoveryCoordinatorOptions;
import com.example.ai.infra.resilience.retry.AdvancedRetryConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Resilience core settings.
 *
 * <p>
 * Blocks:
 * <ul>
 * <li>{@code breaker}: defaults for breakers created by the shared registry</li>
 * <li>{@code retry}: defaults for the shared advanced retry policy</li>
 * <li>{@code recovery}: coordinator sweep and history</li>
 * <li>{@code metrics} / {@code events}: Micrometer gauges and the JSONL event ledger</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "ai.resilience")
public class ResilienceProperties {

    /** Master switch. */
    private boolean enabled = true;

    private final CircuitBreakerProperties breaker = new CircuitBreakerProperties();
    private final AdvancedRetryConfig retry = new AdvancedRetryConfig();
    private final RecoveryCoordinatorOptions recovery = new RecoveryCoordinatorOptions();
    private final Metrics metrics = new Metrics();
    private final Events events = new Events();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public CircuitBreakerProperties getBreaker() {
        return breaker;
    }

    public AdvancedRetryConfig getRetry() {
        return retry;
    }

    public RecoveryCoordinatorOptions getRecovery() {
        return recovery;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Events getEvents() {
        return events;
    }

    public static class Metrics {
        private boolean enabled = true;

        /** Meter name prefix, e.g. {@code ai.resilience.breaker.state}. */
        private String prefix = "ai.resilience";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }
    }

    public static class Events {
        /** Append recovery events as JSONL. */
        private boolean enabled = false;
        private String path = "logs/recovery-events.jsonl";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
