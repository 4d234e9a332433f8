package com.example.ai.infra.resilience.recovery;

public enum RecoveryState {
    HEALTHY,
    RECOVERING,
    FAILED,
    DEGRADED
}
