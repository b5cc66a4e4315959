package io.crisislink.event;

import io.crisislink.model.AlertId;
import io.crisislink.model.ConnectionId;
import io.crisislink.model.CrisisMessage;
import io.crisislink.model.EmergencyResource;
import io.crisislink.model.SessionId;
import io.crisislink.model.SessionStatus;
import io.crisislink.model.SessionSummary;

import java.time.Instant;
import java.util.List;

/**
 * State changes published to clients. Each subscriber sees events in publication order.
 */
public sealed interface SessionEvent permits
        SessionEvent.Connected,
        SessionEvent.Disconnected,
        SessionEvent.Reconnecting,
        SessionEvent.SessionStarted,
        SessionEvent.SessionMatched,
        SessionEvent.QueueUpdate,
        SessionEvent.MessageReceived,
        SessionEvent.EmergencyTriggered,
        SessionEvent.EmergencyResources,
        SessionEvent.SessionEnded {

    Instant timestamp();

    String eventType();

    record Connected(Instant timestamp, ConnectionId connectionId, String transport) implements SessionEvent {
        @Override
        public String eventType() {
            return "connected";
        }
    }

    record Disconnected(Instant timestamp, ConnectionId connectionId, String reason) implements SessionEvent {
        @Override
        public String eventType() {
            return "disconnected";
        }
    }

    record Reconnecting(Instant timestamp, ConnectionId connectionId, int attempt) implements SessionEvent {
        @Override
        public String eventType() {
            return "reconnecting";
        }
    }

    record SessionStarted(
            Instant timestamp,
            SessionId sessionId,
            ConnectionId personConnection,
            SessionStatus status,
            int severity
    ) implements SessionEvent {
        @Override
        public String eventType() {
            return "session.started";
        }
    }

    record SessionMatched(Instant timestamp, SessionId sessionId, ConnectionId volunteer) implements SessionEvent {
        @Override
        public String eventType() {
            return "session.matched";
        }
    }

    record QueueUpdate(Instant timestamp, SessionId sessionId, int position) implements SessionEvent {
        @Override
        public String eventType() {
            return "queue.update";
        }
    }

    record MessageReceived(Instant timestamp, SessionId sessionId, CrisisMessage message) implements SessionEvent {
        @Override
        public String eventType() {
            return "message.received";
        }
    }

    record EmergencyTriggered(
            Instant timestamp,
            SessionId sessionId,
            AlertId alertId,
            String reason
    ) implements SessionEvent {
        @Override
        public String eventType() {
            return "emergency.triggered";
        }
    }

    record EmergencyResources(
            Instant timestamp,
            SessionId sessionId,
            List<EmergencyResource> resources
    ) implements SessionEvent {
        @Override
        public String eventType() {
            return "emergency.resources";
        }
    }

    record SessionEnded(Instant timestamp, SessionId sessionId, SessionSummary summary) implements SessionEvent {
        @Override
        public String eventType() {
            return "session.ended";
        }
    }
}
