package io.crisislink.escalation;

import io.crisislink.model.AlertId;
import io.crisislink.model.EscalationLevel;
import io.crisislink.model.SessionId;

import java.time.Instant;

/** What a channel is told about an escalation. Carries no message content. */
public record EscalationNotice(
        AlertId alertId,
        SessionId sessionId,
        int severity,
        EscalationLevel level,
        String reason,
        boolean anonymous,
        String traceId,
        Instant raisedAt
) {
}
