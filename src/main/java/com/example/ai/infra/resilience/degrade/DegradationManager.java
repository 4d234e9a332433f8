package com.example.ai.infra.resilience.degrade;

/**
 * Registry of reduced-functionality modes per feature or service name.
 *
 * <p>Degrading is triggered by business code; the recovery coordinator only calls {@link #recover(String)}.</p>
 */
public interface DegradationManager {

    void degrade(String name, DegradationLevel level, String reason);

    /** Returns {@code name} to {@link DegradationLevel#FULL}. Unknown names are ignored. */
    void recover(String name);

    boolean isDegraded(String name);

    DegradationLevel getLevel(String name);
}
