package com.example.ai.infra.resilience.fallback;

import com.example.ai.infra.resilience.degrade.DegradationLevel;
import com.example.ai.infra.resilience.degrade.DegradationManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Calls a reduced version of the service, e.g. a smaller model. Availability comes from a caller check;
 * a check that throws reads as unavailable.
 */
public class DegradedServiceFallback<T> implements FallbackStrategy<T> {

    private static final Logger log = LoggerFactory.getLogger(DegradedServiceFallback.class);

    private final Callable<T> degradedOperation;
    private final Callable<Boolean> availabilityCheck;
    private final double qualityScore;

    public DegradedServiceFallback(Callable<T> degradedOperation, Callable<Boolean> availabilityCheck) {
        this(degradedOperation, availabilityCheck, 0.6d);
    }

    public DegradedServiceFallback(Callable<T> degradedOperation, Callable<Boolean> availabilityCheck,
                                   double qualityScore) {
        this.degradedOperation = Objects.requireNonNull(degradedOperation, "degradedOperation");
        this.availabilityCheck = Objects.requireNonNull(availabilityCheck, "availabilityCheck");
        this.qualityScore = Fallbacks.checkQuality(qualityScore);
    }

    /**
     * Degraded service tracked in {@code degradation} under {@code name}: available unless that name is
     * {@link DegradationLevel#UNAVAILABLE}.
     */
    public static <T> DegradedServiceFallback<T> tracked(DegradationManager degradation, String name,
                                                          Callable<T> degradedOperation) {
        Objects.requireNonNull(degradation, "degradation");
        Objects.requireNonNull(name, "name");
        return new DegradedServiceFallback<>(degradedOperation,
                () -> degradation.getLevel(name) != DegradationLevel.UNAVAILABLE);
    }

    @Override
    public T execute() throws Exception {
        return degradedOperation.call();
    }

    @Override
    public boolean isAvailable() {
        try {
            return Boolean.TRUE.equals(availabilityCheck.call());
        } catch (Exception e) {
            log.debug("[Fallback] degraded availability check failed err={}", e.toString());
            return false;
        }
    }

    @Override
    public double getQualityScore() {
        return qualityScore;
    }
}
