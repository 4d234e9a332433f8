package com.example.ai.infra.resilience.recovery;

import java.util.Locale;

public enum RecoveryEventType {
    STARTED,
    SUCCEEDED,
    FAILED,
    DEGRADED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
