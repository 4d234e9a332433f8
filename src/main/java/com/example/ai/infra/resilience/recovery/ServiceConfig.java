package com.example.ai.infra.resilience.recovery;

import com.example.ai.infra.resilience.breaker.AdaptiveCircuitBreaker;
import com.example.ai.infra.resilience.breaker.CircuitBreaker;
import com.example.ai.infra.resilience.retry.AdvancedRetryPolicy;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Set;

/**
 * Registration of one service with the {@link RecoveryCoordinator}.
 *
 * <p>Breaker and retry policy are borrowed references: business code keeps using them on the hot path
 * and the coordinator only inspects and resets them. Supply either {@code circuitBreaker} or
 * {@code adaptiveBreaker}; the adaptive one also surfaces a health score.</p>
 */
@Getter
@Builder(toBuilder = true)
@ToString(of = {"name", "strategy", "priority", "dependencies"})
public class ServiceConfig {

    private final String name;
    private final CircuitBreaker circuitBreaker;
    private final AdaptiveCircuitBreaker adaptiveBreaker;
    private final AdvancedRetryPolicy retryPolicy;
    @Singular
    private final Set<String> dependencies;
    @Builder.Default
    private final RecoveryStrategy strategy = RecoveryStrategy.GRADUAL;
    private final HealthCheck healthCheck;
    /** Higher runs first in the automatic sweep. */
    @Builder.Default
    private final int priority = 5;
    @Builder.Default
    private final int maxRecoveryAttempts = 5;

    /** The breaker to inspect, from whichever field was set. */
    public CircuitBreaker breaker() {
        if (adaptiveBreaker != null) {
            return adaptiveBreaker.getDelegate();
        }
        return circuitBreaker;
    }
}
