package com.example.ai.config;

import com.example.ai.infra.resilience.breaker.CircuitBreakerRegistry;
import com.example.ai.infra.resilience.degrade.DegradationManager;
import com.example.ai.infra.resilience.degrade.InMemoryDegradationManager;
import com.example.ai.infra.resilience.error.DefaultErrorClassifier;
import com.example.ai.infra.resilience.error.ErrorClassifier;
import com.example.ai.infra.resilience.recovery.RecoveryCoordinator;
import com.example.ai.infra.resilience.recovery.RecoveryEventJsonlWriter;
import com.example.ai.infra.resilience.recovery.RecoveryEventListener;
import com.example.ai.infra.resilience.retry.AdvancedRetryPolicy;
import com.example.ai.infra.resilience.retry.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resilience core wiring: shared breaker registry, retry policy, classifier, degradation registry and the
 * recovery coordinator. Every bean backs off when the application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(ResilienceProperties.class)
@ConditionalOnProperty(name = "ai.resilience.enabled", havingValue = "true", matchIfMissing = true)
public class ResilienceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "resilienceClock")
    public Clock resilienceClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "resilienceScheduler")
    public ScheduledExecutorService resilienceScheduler() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "resilience-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "resilienceAttemptExecutor")
    public ExecutorService resilienceAttemptExecutor() {
        return RetryPolicy.newAttemptExecutor();
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry circuitBreakerRegistry(ResilienceProperties props, Clock resilienceClock,
            ScheduledExecutorService resilienceScheduler) {
        return new CircuitBreakerRegistry(props.getBreaker(), resilienceClock, resilienceScheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier() {
        return new DefaultErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public DegradationManager degradationManager() {
        return new InMemoryDegradationManager();
    }

    @Bean
    @ConditionalOnMissingBean
    public AdvancedRetryPolicy advancedRetryPolicy(ResilienceProperties props, ErrorClassifier errorClassifier,
            Clock resilienceClock,
            @Qualifier("resilienceAttemptExecutor") ExecutorService resilienceAttemptExecutor) {
        return new AdvancedRetryPolicy(props.getRetry(), errorClassifier, resilienceClock, resilienceAttemptExecutor);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    public RecoveryCoordinator recoveryCoordinator(ResilienceProperties props,
            DegradationManager degradationManager,
            Clock resilienceClock,
            ScheduledExecutorService resilienceScheduler,
            ObjectProvider<RecoveryEventListener> listeners) {
        RecoveryCoordinator coordinator = new RecoveryCoordinator(props.getRecovery(), degradationManager,
                resilienceClock, resilienceScheduler);
        listeners.orderedStream().forEach(coordinator::addListener);
        return coordinator;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "ai.resilience.events.enabled", havingValue = "true")
    public RecoveryEventJsonlWriter recoveryEventJsonlWriter(ObjectProvider<ObjectMapper> om,
            ResilienceProperties props) {
        ObjectMapper mapper = om.getIfAvailable(ObjectMapper::new);
        return new RecoveryEventJsonlWriter(mapper, Path.of(props.getEvents().getPath()), true);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnProperty(name = "ai.resilience.metrics.enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ResilienceMeterBinder resilienceMeterBinder(CircuitBreakerRegistry registry,
                ResilienceProperties props,
                ObjectProvider<MeterRegistry> meterRegistry) {
            ResilienceMeterBinder binder = new ResilienceMeterBinder(registry, props.getMetrics().getPrefix());
            MeterRegistry r = meterRegistry.getIfAvailable();
            if (r != null) {
                binder.bindTo(r);
            }
            return binder;
        }
    }
}
