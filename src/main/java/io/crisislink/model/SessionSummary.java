package io.crisislink.model;

import java.time.Instant;

public record SessionSummary(
        SessionId sessionId,
        SessionStatus status,
        int severity,
        boolean emergency,
        boolean anonymous,
        int messageCount,
        int escalationCount,
        String endReason,
        Integer rating,
        String comment,
        Instant startedAt,
        Instant endedAt,
        long durationMs
) {
}
