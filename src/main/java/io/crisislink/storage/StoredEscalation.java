package io.crisislink.storage;

public record StoredEscalation(
        String alertId,
        String sessionId,
        int severity,
        String level,
        String reason,
        String contactedServices,
        long elapsedMs,
        long createdAtMs
) {
}
