package com.example.ai.infra.resilience.recovery;

import java.util.Map;

/**
 * One entry of the coordinator's event log.
 *
 * @param details reason text, null for "started" and "succeeded"
 * @param metrics circuit/retry summary attached to "succeeded", empty otherwise
 */
public record RecoveryEvent(
        RecoveryEventType type,
        String service,
        long timestampMs,
        String details,
        Map<String, Object> metrics) {

    public RecoveryEvent {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    static RecoveryEvent of(RecoveryEventType type, String service, long timestampMs, String details) {
        return new RecoveryEvent(type, service, timestampMs, details, Map.of());
    }
}
