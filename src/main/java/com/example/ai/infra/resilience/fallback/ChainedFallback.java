package com.example.ai.infra.resilience.fallback;

import com.example.ai.infra.resilience.FallbackUnavailableException;
import com.example.ai.infra.resilience.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Tries each strategy in order, skipping unavailable ones, until one returns a value.
 */
public class ChainedFallback<T> implements FallbackStrategy<T> {

    private static final Logger log = LoggerFactory.getLogger(ChainedFallback.class);

    private final List<FallbackStrategy<? extends T>> strategies;

    public ChainedFallback(List<? extends FallbackStrategy<? extends T>> strategies) {
        Objects.requireNonNull(strategies, "strategies");
        this.strategies = List.copyOf(strategies);
    }

    /**
     * @throws FallbackUnavailableException when no strategy produced a value; their failures are suppressed
     * @throws OperationCancelledException  as soon as a strategy reports cancellation
     */
    @Override
    public T execute() throws Exception {
        List<Exception> errors = new ArrayList<>();
        for (FallbackStrategy<? extends T> strategy : strategies) {
            if (!strategy.isAvailable()) {
                continue;
            }
            try {
                return strategy.execute();
            } catch (Exception e) {
                if (OperationCancelledException.isCancellation(e)) {
                    throw e;
                }
                log.debug("[Fallback] chained strategy failed strategy={} err={}",
                        strategy.getClass().getSimpleName(), e.toString());
                errors.add(e);
            }
        }
        FallbackUnavailableException ex = new FallbackUnavailableException("All fallback strategies failed: "
                + errors.stream().map(Throwable::getMessage).collect(Collectors.joining(", ")));
        errors.forEach(ex::addSuppressed);
        throw ex;
    }

    @Override
    public boolean isAvailable() {
        for (FallbackStrategy<? extends T> strategy : strategies) {
            if (strategy.isAvailable()) {
                return true;
            }
        }
        return false;
    }

    /** Best score among the chained strategies. */
    @Override
    public double getQualityScore() {
        double best = 0.0d;
        for (FallbackStrategy<? extends T> strategy : strategies) {
            best = Math.max(best, strategy.getQualityScore());
        }
        return best;
    }

    @Override
    public void cleanup() {
        Fallbacks.cleanupAll(strategies);
    }
}
