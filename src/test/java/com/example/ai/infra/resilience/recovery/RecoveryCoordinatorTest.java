package com.example.ai.infra.resilience.recovery;

import com.example.ai.infra.resilience.MutableClock;
import com.example.ai.infra.resilience.OperationCancelledException;
import com.example.ai.infra.resilience.breaker.AdaptiveCircuitBreaker;
import com.example.ai.infra.resilience.breaker.CircuitBreaker;
import com.example.ai.infra.resilience.breaker.CircuitBreakerProperties;
import com.example.ai.infra.resilience.breaker.CircuitState;
import com.example.ai.infra.resilience.degrade.DegradationManager;
import com.example.ai.infra.resilience.retry.AdvancedRetryConfig;
import com.example.ai.infra.resilience.retry.AdvancedRetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecoveryCoordinatorTest {

    private final MutableClock clock = MutableClock.atEpochMillis(1_000L);
    private final DegradationManager degradation = mock(DegradationManager.class);
    private final List<RecoveryEvent> received = Collections.synchronizedList(new ArrayList<>());
    private RecoveryCoordinator coordinator = coordinator(new RecoveryCoordinatorOptions());

    private RecoveryCoordinator coordinator(RecoveryCoordinatorOptions options) {
        RecoveryCoordinator c = new RecoveryCoordinator(options, degradation, clock, null);
        c.addListener(received::add);
        return c;
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    private CircuitBreaker breaker(String name) {
        CircuitBreakerProperties p = new CircuitBreakerProperties();
        p.setResetTimeoutMs(10_000L);
        p.setHalfOpenTrialCount(3);
        return new CircuitBreaker(name, p, clock);
    }

    private RecoveryEvent lastEvent() {
        List<RecoveryEvent> history = coordinator.getHistory();
        return history.get(history.size() - 1);
    }

    @Test
    void coordinated_withFailedDependency_failsWithoutProbing() throws Exception {
        HealthCheck probe = mock(HealthCheck.class);
        when(probe.check()).thenReturn(true);
        coordinator.registerService(ServiceConfig.builder().name("vector-store").build());
        coordinator.registerService(ServiceConfig.builder()
                .name("rag")
                .strategy(RecoveryStrategy.COORDINATED)
                .dependency("vector-store")
                .healthCheck(probe)
                .build());
        coordinator.markFailed("vector-store", "connection refused");

        assertFalse(coordinator.recoverService("rag"));

        verify(probe, never()).check();
        RecoveryStatus status = coordinator.getStatus("rag");
        assertFalse(status.dependenciesHealthy());
        assertEquals(RecoveryState.FAILED, status.state());
        assertEquals(RecoveryEventType.FAILED, lastEvent().type());
        assertEquals("Dependencies not healthy", lastEvent().details());
    }

    @Test
    void coordinated_withHealthyDependency_probesAndSucceeds() throws Exception {
        HealthCheck probe = mock(HealthCheck.class);
        when(probe.check()).thenReturn(true);
        coordinator.registerService(ServiceConfig.builder().name("vector-store").build());
        coordinator.registerService(ServiceConfig.builder()
                .name("rag")
                .strategy(RecoveryStrategy.COORDINATED)
                .dependency("vector-store")
                .healthCheck(probe)
                .build());
        coordinator.markDegraded("rag", "slow");

        assertTrue(coordinator.recoverService("rag"));

        verify(probe).check();
        assertTrue(coordinator.getStatus("rag").dependenciesHealthy());
    }

    @Test
    void unregisteredDependency_countsAsUnhealthy() {
        coordinator.registerService(ServiceConfig.builder()
                .name("rag")
                .strategy(RecoveryStrategy.COORDINATED)
                .dependency("not-there")
                .build());

        assertFalse(coordinator.recoverService("rag"));
    }

    @Test
    void dependencyWithOpenBreaker_countsAsUnhealthy() {
        CircuitBreaker depBreaker = breaker("search");
        depBreaker.forceOpen("outage");
        coordinator.registerService(ServiceConfig.builder().name("search").circuitBreaker(depBreaker).build());
        coordinator.registerService(ServiceConfig.builder()
                .name("answer")
                .strategy(RecoveryStrategy.COORDINATED)
                .dependency("search")
                .build());

        assertFalse(coordinator.recoverService("answer"));
        assertFalse(coordinator.getStatus("answer").dependenciesHealthy());
    }

    @Test
    void attemptCount_growsOnFailureAndResetsOnSuccessOnly() throws Exception {
        HealthCheck probe = mock(HealthCheck.class);
        when(probe.check()).thenReturn(false, false, true);
        coordinator.registerService(ServiceConfig.builder().name("llm").healthCheck(probe).build());

        assertFalse(coordinator.recoverService("llm"));
        assertEquals(1, coordinator.getStatus("llm").attemptCount());
        assertFalse(coordinator.recoverService("llm"));
        assertEquals(2, coordinator.getStatus("llm").attemptCount());
        assertEquals(clock.millis(), coordinator.getStatus("llm").lastFailureMs());

        assertTrue(coordinator.recoverService("llm"));
        RecoveryStatus status = coordinator.getStatus("llm");
        assertEquals(0, status.attemptCount());
        assertEquals(RecoveryState.HEALTHY, status.state());
        assertEquals(clock.millis(), status.lastSuccessMs());
    }

    @Test
    void maxAttemptsReached_refusesAndEmitsFailedEvent() throws Exception {
        HealthCheck probe = mock(HealthCheck.class);
        when(probe.check()).thenReturn(false);
        coordinator.registerService(ServiceConfig.builder().name("llm").healthCheck(probe).maxRecoveryAttempts(2).build());
        coordinator.recoverService("llm");
        coordinator.recoverService("llm");

        assertFalse(coordinator.recoverService("llm"));

        verify(probe, times(2)).check();
        assertEquals(2, coordinator.getStatus("llm").attemptCount());
        assertEquals(RecoveryEventType.FAILED, lastEvent().type());
        assertEquals("Maximum recovery attempts exceeded", lastEvent().details());
    }

    @Test
    void concurrencyCap_refusesWhileAnotherRecoveryRuns() throws Exception {
        RecoveryCoordinatorOptions options = new RecoveryCoordinatorOptions();
        options.setMaxConcurrentRecoveries(1);
        coordinator = coordinator(options);
        CountDownLatch probing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        coordinator.registerService(ServiceConfig.builder().name("slow").healthCheck(() -> {
            probing.countDown();
            return release.await(5, TimeUnit.SECONDS);
        }).build());
        HealthCheck other = mock(HealthCheck.class);
        coordinator.registerService(ServiceConfig.builder().name("other").healthCheck(other).build());

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> slow = pool.submit(() -> coordinator.recoverService("slow"));
            assertTrue(probing.await(5, TimeUnit.SECONDS));
            assertEquals(1, coordinator.getActiveRecoveries());
            assertEquals(RecoveryState.RECOVERING, coordinator.getStatus("slow").state());

            assertFalse(coordinator.recoverService("other"));
            assertFalse(coordinator.recoverService("slow"), "already in flight");
            verify(other, never()).check();

            release.countDown();
            assertTrue(slow.get(5, TimeUnit.SECONDS));
            assertEquals(0, coordinator.getActiveRecoveries());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void manualStrategy_neverRecoversOnItsOwn() {
        coordinator.registerService(ServiceConfig.builder().name("billing").strategy(RecoveryStrategy.MANUAL).build());
        coordinator.markFailed("billing", "operator hold");

        assertFalse(coordinator.recoverService("billing"));
        assertEquals(RecoveryState.FAILED, coordinator.getStatus("billing").state());
    }

    @Test
    void gradual_withOpenBreaker_waitsForResetTimeout() throws Exception {
        CircuitBreaker cb = breaker("llm");
        cb.forceOpen("outage");
        HealthCheck probe = mock(HealthCheck.class);
        coordinator.registerService(ServiceConfig.builder().name("llm").circuitBreaker(cb).healthCheck(probe).build());

        assertFalse(coordinator.recoverService("llm"));

        verify(probe, never()).check();
        assertEquals(CircuitState.OPEN, cb.getState());
    }

    @Test
    void gradual_withSuccessfulHalfOpenTrials_recoversAndCloses() throws Exception {
        CircuitBreaker cb = breaker("llm");
        cb.forceOpen("outage");
        clock.advanceMillis(10_000L);
        cb.execute(() -> "trial");
        assertEquals(CircuitState.HALF_OPEN, cb.getState());
        coordinator.registerService(ServiceConfig.builder().name("llm").circuitBreaker(cb).build());

        assertTrue(coordinator.recoverService("llm"));

        assertEquals(CircuitState.CLOSED, cb.getState());
    }

    @Test
    void gradual_halfOpenWithoutCompletedTrials_doesNotRecover() {
        CircuitBreaker cb = breaker("llm");
        cb.forceOpen("outage");
        clock.advanceMillis(10_000L);
        assertThrows(OperationCancelledException.class, () -> cb.execute(() -> {
            throw new OperationCancelledException("caller went away");
        }));
        assertEquals(CircuitState.HALF_OPEN, cb.getState());
        coordinator.registerService(ServiceConfig.builder().name("llm").circuitBreaker(cb).build());

        assertFalse(coordinator.recoverService("llm"));
        assertEquals(CircuitState.HALF_OPEN, cb.getState());
    }

    @Test
    void gradual_healthyProbe_resetsBreaker() throws Exception {
        CircuitBreaker cb = breaker("llm");
        coordinator.registerService(ServiceConfig.builder().name("llm").circuitBreaker(cb).healthCheck(() -> true).build());
        coordinator.markDegraded("llm", "p99 high");

        assertTrue(coordinator.recoverService("llm"));
        assertEquals(RecoveryState.HEALTHY, coordinator.getStatus("llm").state());
    }

    @Test
    void immediate_resetsOpenBreakerBeforeProbing() throws Exception {
        CircuitBreaker cb = breaker("llm");
        cb.forceOpen("outage");
        coordinator.registerService(ServiceConfig.builder()
                .name("llm")
                .circuitBreaker(cb)
                .strategy(RecoveryStrategy.IMMEDIATE)
                .healthCheck(() -> cb.getState() == CircuitState.CLOSED)
                .build());

        assertTrue(coordinator.recoverService("llm"));
        assertEquals(CircuitState.CLOSED, cb.getState());
    }

    @Test
    void throwingProbe_failsWithItsMessage() {
        coordinator.registerService(ServiceConfig.builder().name("llm").healthCheck(() -> {
            throw new IllegalStateException("probe exploded");
        }).build());

        assertFalse(coordinator.recoverService("llm"));
        assertEquals("probe exploded", lastEvent().details());
    }

    @Test
    void success_resetsRetryPolicyClearsDegradationAndReportsMetrics() throws Exception {
        AdaptiveCircuitBreaker adaptive = new AdaptiveCircuitBreaker(breaker("llm"));
        AdvancedRetryConfig retryConfig = new AdvancedRetryConfig();
        retryConfig.setTimeoutMs(0L);
        AdvancedRetryPolicy retry = new AdvancedRetryPolicy(retryConfig);
        retry.execute(attempt -> "warm");
        coordinator.registerService(ServiceConfig.builder()
                .name("llm")
                .adaptiveBreaker(adaptive)
                .retryPolicy(retry)
                .build());
        coordinator.markFailed("llm", "outage");

        assertTrue(coordinator.recoverService("llm"));

        verify(degradation).recover("llm");
        assertEquals(0, retry.getMetrics().totalAttempts());
        RecoveryEvent succeeded = lastEvent();
        assertEquals(RecoveryEventType.SUCCEEDED, succeeded.type());
        assertThat(succeeded.metrics()).containsKeys("circuit", "retry");
        assertEquals(100, coordinator.getStatus("llm").healthScore());
        assertEquals(CircuitState.CLOSED, coordinator.getStatus("llm").circuitState());
    }

    @Test
    void degradationManagerFailure_doesNotFailRecovery() {
        doThrow(new IllegalStateException("store down")).when(degradation).recover("llm");
        coordinator.registerService(ServiceConfig.builder().name("llm").build());

        assertTrue(coordinator.recoverService("llm"));
    }

    @Test
    void events_arePublishedInOrderAndListenerFailuresAreSwallowed() throws Exception {
        coordinator.addListener(e -> {
            throw new IllegalStateException("listener bug");
        });
        coordinator.registerService(ServiceConfig.builder().name("llm").healthCheck(() -> true).build());

        assertTrue(coordinator.recoverService("llm"));

        assertThat(received).extracting(RecoveryEvent::type)
                .containsExactly(RecoveryEventType.STARTED, RecoveryEventType.SUCCEEDED);
    }

    @Test
    void sweep_recoversNeedyServicesByDescendingPriority() {
        List<String> probed = Collections.synchronizedList(new ArrayList<>());
        coordinator.registerService(ServiceConfig.builder().name("low").priority(1)
                .healthCheck(() -> probed.add("low")).build());
        coordinator.registerService(ServiceConfig.builder().name("high").priority(9)
                .healthCheck(() -> probed.add("high")).build());
        coordinator.registerService(ServiceConfig.builder().name("fine").priority(5)
                .healthCheck(() -> probed.add("fine")).build());
        coordinator.registerService(ServiceConfig.builder().name("manual").priority(10)
                .strategy(RecoveryStrategy.MANUAL).healthCheck(() -> probed.add("manual")).build());
        coordinator.markFailed("low", "x");
        coordinator.markDegraded("high", "y");
        coordinator.markFailed("manual", "z");

        coordinator.checkRecoveries();

        assertThat(probed).containsExactly("high", "low");
        assertEquals(RecoveryState.FAILED, coordinator.getStatus("manual").state());
    }

    @Test
    void sweep_picksUpServiceWhoseBreakerIsOpen() {
        CircuitBreaker cb = breaker("llm");
        coordinator.registerService(ServiceConfig.builder().name("llm").circuitBreaker(cb)
                .strategy(RecoveryStrategy.IMMEDIATE).build());
        cb.forceOpen("outage");

        coordinator.checkRecoveries();

        assertEquals(CircuitState.CLOSED, cb.getState());
    }

    @Test
    void history_isTrimmedToRetainOnceCapacityIsExceeded() {
        RecoveryCoordinatorOptions options = new RecoveryCoordinatorOptions();
        options.setHistoryCapacity(4);
        options.setHistoryRetain(2);
        coordinator = coordinator(options);
        coordinator.registerService(ServiceConfig.builder().name("llm").build());

        for (int i = 1; i <= 5; i++) {
            coordinator.markDegraded("llm", "d" + i);
        }

        assertThat(coordinator.getHistory()).extracting(RecoveryEvent::details).containsExactly("d4", "d5");
        assertThat(coordinator.getHistory(1)).extracting(RecoveryEvent::details).containsExactly("d5");
    }

    @Test
    void registration_rejectsDuplicatesAndUnknownNames() {
        coordinator.registerService(ServiceConfig.builder().name("llm").build());

        assertThrows(IllegalArgumentException.class,
                () -> coordinator.registerService(ServiceConfig.builder().name("llm").build()));
        assertThrows(IllegalArgumentException.class,
                () -> coordinator.registerService(ServiceConfig.builder().name(" ").build()));
        assertThrows(IllegalArgumentException.class, () -> coordinator.recoverService("ghost"));
        assertThrows(IllegalArgumentException.class, () -> coordinator.markFailed("ghost", "x"));
        assertNull(coordinator.getStatus("ghost"));

        assertTrue(coordinator.unregisterService("llm"));
        assertFalse(coordinator.isRegistered("llm"));
    }

    @Test
    void getAllStatus_isOrderedByName() {
        coordinator.registerService(ServiceConfig.builder().name("b").build());
        coordinator.registerService(ServiceConfig.builder().name("a").build());

        assertThat(coordinator.getAllStatus().keySet()).containsExactly("a", "b");
    }

    @Test
    void start_schedulesSweepOnlyWhenAutoRecoverIsOn() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        RecoveryCoordinator manual = new RecoveryCoordinator(new RecoveryCoordinatorOptions(), null, clock, scheduler);
        manual.start();
        verify(scheduler, never()).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));

        RecoveryCoordinatorOptions options = new RecoveryCoordinatorOptions();
        options.setAutoRecover(true);
        options.setCheckIntervalMs(5_000L);
        RecoveryCoordinator auto = new RecoveryCoordinator(options, null, clock, scheduler);
        auto.start();

        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(5_000L), eq(5_000L), eq(TimeUnit.MILLISECONDS));
        auto.close();
    }
}
