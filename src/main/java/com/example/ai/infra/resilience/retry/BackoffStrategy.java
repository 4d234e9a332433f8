package com.example.ai.infra.resilience.retry;

/**
 * Delay growth between attempts.
 *
 * <ul>
 * <li>EXPONENTIAL: {@code initialDelay * multiplier^i}</li>
 * <li>LINEAR: {@code initialDelay + multiplier * i * 1000}</li>
 * <li>FIXED: {@code initialDelay}</li>
 * </ul>
 */
public enum BackoffStrategy {
    EXPONENTIAL,
    LINEAR,
    FIXED
}
