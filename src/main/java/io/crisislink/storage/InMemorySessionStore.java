package io.crisislink.storage;

import io.crisislink.model.CrisisMessage;
import io.crisislink.model.EscalationEvent;
import io.crisislink.model.SessionId;
import io.crisislink.model.SessionSummary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySessionStore implements SessionStore {
    private final Map<String, StoredMessage> messages = new ConcurrentHashMap<>();
    private final Map<String, StoredEscalation> escalations = new ConcurrentHashMap<>();
    private final Map<SessionId, SessionSummary> summaries = new ConcurrentHashMap<>();

    @Override
    public void saveMessage(CrisisMessage message) {
        messages.put(message.id().value(), new StoredMessage(
                message.id().value(),
                message.sessionId().value(),
                message.sequence(),
                message.senderRole(),
                message.kind(),
                message.priority(),
                message.payload(),
                message.encrypted(),
                message.compressed(),
                message.status(),
                message.retryCount(),
                message.sentAt().toEpochMilli()
        ));
    }

    @Override
    public List<StoredMessage> loadSessionHistory(SessionId sessionId) {
        List<StoredMessage> out = new ArrayList<>();
        for (StoredMessage message : messages.values()) {
            if (message.sessionId().equals(sessionId.value())) {
                out.add(message);
            }
        }
        out.sort(Comparator.comparingLong(StoredMessage::sequence));
        return out;
    }

    @Override
    public void saveEscalation(EscalationEvent event) {
        escalations.put(event.alertId().value(), new StoredEscalation(
                event.alertId().value(),
                event.sessionId().value(),
                event.severity(),
                event.level().name(),
                event.reason(),
                String.join(",", event.contactedServices()),
                event.elapsedMs(),
                event.createdAt().toEpochMilli()
        ));
    }

    @Override
    public List<StoredEscalation> loadEscalations(SessionId sessionId) {
        return escalations.values().stream()
                .filter(e -> e.sessionId().equals(sessionId.value()))
                .sorted(Comparator.comparingLong(StoredEscalation::createdAtMs))
                .toList();
    }

    @Override
    public void saveSessionSummary(SessionSummary summary) {
        summaries.put(summary.sessionId(), summary);
    }

    @Override
    public Optional<SessionSummary> loadSessionSummary(SessionId sessionId) {
        return Optional.ofNullable(summaries.get(sessionId));
    }
}
