package com.example.ai.infra.resilience.degrade;

/**
 * Severity ladder, from fully functional to unavailable.
 */
public enum DegradationLevel {
    FULL,
    PARTIAL,
    MINIMAL,
    UNAVAILABLE
}
