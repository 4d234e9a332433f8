package com.example.ai.config;

import com.example.ai.infra.resilience.breaker.CircuitBreakerRegistry;
import com.example.ai.infra.resilience.degrade.DegradationManager;
import com.example.ai.infra.resilience.degrade.InMemoryDegradationManager;
import com.example.ai.infra.resilience.error.ErrorClassifier;
import com.example.ai.infra.resilience.recovery.RecoveryCoordinator;
import com.example.ai.infra.resilience.recovery.RecoveryEventJsonlWriter;
import com.example.ai.infra.resilience.recovery.RecoveryEventType;
import com.example.ai.infra.resilience.recovery.ServiceConfig;
import com.example.ai.infra.resilience.retry.AdvancedRetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ResilienceAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ResilienceAutoConfiguration.class));

    @TempDir
    Path dir;

    @Test
    void defaults_registerCoreBeans() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(CircuitBreakerRegistry.class);
            assertThat(ctx).hasSingleBean(AdvancedRetryPolicy.class);
            assertThat(ctx).hasSingleBean(ErrorClassifier.class);
            assertThat(ctx).hasSingleBean(DegradationManager.class);
            assertThat(ctx).hasSingleBean(RecoveryCoordinator.class);
            assertThat(ctx).doesNotHaveBean(RecoveryEventJsonlWriter.class);
            assertThat(ctx).hasSingleBean(ResilienceMeterBinder.class);
        });
    }

    @Test
    void disabled_registersNothing() {
        runner.withPropertyValues("ai.resilience.enabled=false").run(ctx -> {
            assertThat(ctx).doesNotHaveBean(CircuitBreakerRegistry.class);
            assertThat(ctx).doesNotHaveBean(RecoveryCoordinator.class);
        });
    }

    @Test
    void properties_bindIntoBreakerAndRetryConfig() {
        runner.withPropertyValues(
                "ai.resilience.breaker.failure-threshold=0.3",
                "ai.resilience.breaker.request-threshold=4",
                "ai.resilience.retry.name=llm",
                "ai.resilience.retry.max-retries=5",
                "ai.resilience.retry.retry-budget=7",
                "ai.resilience.recovery.max-concurrent-recoveries=2").run(ctx -> {
            CircuitBreakerRegistry registry = ctx.getBean(CircuitBreakerRegistry.class);
            assertEquals(0.3d, registry.get("any").getProperties().getFailureThreshold(), 1e-9);
            assertEquals(4, registry.get("any").getProperties().getRequestThreshold());

            AdvancedRetryPolicy retry = ctx.getBean(AdvancedRetryPolicy.class);
            assertEquals("llm", retry.getName());
            assertEquals(5, retry.getConfig().getMaxRetries());
            assertEquals(7, retry.getConfig().getRetryBudget());

            assertEquals(2, ctx.getBean(ResilienceProperties.class).getRecovery().getMaxConcurrentRecoveries());
        });
    }

    @Test
    void invalidProperties_failStartup() {
        runner.withPropertyValues("ai.resilience.breaker.failure-threshold=2.0")
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Test
    void userBeans_winOverDefaults() {
        DegradationManager custom = new InMemoryDegradationManager();
        runner.withBean("customDegradation", DegradationManager.class, () -> custom).run(ctx ->
                assertSame(custom, ctx.getBean(DegradationManager.class)));
    }

    @Test
    void defaults_exposeAttemptExecutorBean() {
        runner.run(ctx -> assertThat(ctx).hasBean("resilienceAttemptExecutor"));
    }

    @Test
    void retryPolicy_runsAttemptsOnAttemptExecutorBean() throws Exception {
        ThreadPoolExecutor attempts = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>());
        try {
            runner.withBean("resilienceAttemptExecutor", ExecutorService.class, () -> attempts).run(ctx -> {
                AdvancedRetryPolicy retry = ctx.getBean(AdvancedRetryPolicy.class);

                String result = retry.execute(attempt -> "ok");

                assertEquals("ok", result);
                assertEquals(1L, attempts.getTaskCount());
            });
        } finally {
            attempts.shutdownNow();
        }
    }

    @Test
    void eventsEnabled_writesRecoveryEventsToJsonl() {
        Path file = dir.resolve("events.jsonl");
        runner.withPropertyValues(
                "ai.resilience.events.enabled=true",
                "ai.resilience.events.path=" + file).run(ctx -> {
            assertThat(ctx).hasSingleBean(RecoveryEventJsonlWriter.class);
            RecoveryCoordinator coordinator = ctx.getBean(RecoveryCoordinator.class);
            coordinator.registerService(ServiceConfig.builder().name("llm").build());
            coordinator.markFailed("llm", "outage");

            assertTrue(Files.exists(file));
            List<String> lines = Files.readAllLines(file);
            assertEquals(1, lines.size());
            assertThat(lines.get(0)).contains("\"type\":\"failed\"");
        });
    }

    @Test
    void meterBinder_exportsBreakerStateAndRecoveryEvents() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new).run(ctx -> {
            MeterRegistry meters = ctx.getBean(MeterRegistry.class);
            CircuitBreakerRegistry registry = ctx.getBean(CircuitBreakerRegistry.class);
            registry.get("openai").forceOpen("outage");

            assertEquals(2.0d, meters.get("ai.resilience.breaker.state").tag("name", "openai").gauge().value());
            assertEquals(1.0d, meters.get("ai.resilience.breaker.transitions")
                    .tag("name", "openai").tag("to", "open").counter().count());

            RecoveryCoordinator coordinator = ctx.getBean(RecoveryCoordinator.class);
            coordinator.registerService(ServiceConfig.builder().name("openai").build());
            coordinator.markDegraded("openai", "slow");
            assertEquals(1.0d, meters.get("ai.resilience.recovery.events")
                    .tag("type", RecoveryEventType.DEGRADED.code()).tag("service", "openai").counter().count());
        });
    }

    @Test
    void metricsDisabled_skipsBinder() {
        runner.withPropertyValues("ai.resilience.metrics.enabled=false")
                .withBean(MeterRegistry.class, () -> mock(MeterRegistry.class))
                .run(ctx -> assertThat(ctx).doesNotHaveBean(ResilienceMeterBinder.class));
    }
}
