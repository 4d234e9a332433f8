package com.example.ai.infra.resilience.fallback;

import java.util.ArrayList;
import java.util.List;

final class Fallbacks {

    private Fallbacks() {
    }

    static double checkQuality(double qualityScore) {
        if (qualityScore < 0.0d || qualityScore > 1.0d) {
            throw new IllegalArgumentException("qualityScore must be in [0,1]: " + qualityScore);
        }
        return qualityScore;
    }

    static void cleanupAll(List<? extends FallbackStrategy<?>> strategies) {
        List<RuntimeException> failures = new ArrayList<>();
        for (FallbackStrategy<?> s : strategies) {
            try {
                s.cleanup();
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            RuntimeException first = failures.get(0);
            for (int i = 1; i < failures.size(); i++) {
                first.addSuppressed(failures.get(i));
            }
            throw first;
        }
    }
}
