package io.crisislink.model;

import java.time.Instant;
import java.util.List;

public record EscalationEvent(
        AlertId alertId,
        SessionId sessionId,
        int severity,
        EscalationLevel level,
        String reason,
        List<ChannelOutcome> outcomes,
        List<String> contactedServices,
        long elapsedMs,
        String traceId,
        Instant createdAt
) {
    public EscalationEvent {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        contactedServices = contactedServices == null ? List.of() : List.copyOf(contactedServices);
    }

    public long unreachedCount() {
        return outcomes.stream().filter(o -> !o.reached()).count();
    }
}
