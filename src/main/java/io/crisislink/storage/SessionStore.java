package io.crisislink.storage;

import io.crisislink.model.CrisisMessage;
import io.crisislink.model.EscalationEvent;
import io.crisislink.model.SessionId;
import io.crisislink.model.SessionSummary;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of sessions, their messages and escalations. Saving a message again
 * updates its delivery status.
 */
public interface SessionStore {
    void saveMessage(CrisisMessage message);

    List<StoredMessage> loadSessionHistory(SessionId sessionId);

    void saveEscalation(EscalationEvent event);

    List<StoredEscalation> loadEscalations(SessionId sessionId);

    void saveSessionSummary(SessionSummary summary);

    Optional<SessionSummary> loadSessionSummary(SessionId sessionId);
}
