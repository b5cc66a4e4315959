package io.crisislink.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.time.Instant;

/**
 * A message inside one session. Identity, content and ordering are fixed at creation;
 * only the delivery status and retry count move afterwards, and an acknowledged
 * message never changes status again.
 */
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE
)
public final class CrisisMessage {
    private final MessageId id;
    private final SessionId sessionId;
    private final long sequence;
    private final Role senderRole;
    private final MessageKind kind;
    private final MessagePriority priority;
    private final String payload;
    private final boolean encrypted;
    private final boolean compressed;
    private final Instant sentAt;
    private DeliveryStatus status;
    private int retryCount;
    private Instant acknowledgedAt;

    public CrisisMessage(
            MessageId id,
            SessionId sessionId,
            long sequence,
            Role senderRole,
            MessageKind kind,
            MessagePriority priority,
            String payload,
            boolean encrypted,
            boolean compressed,
            Instant sentAt
    ) {
        this.id = id;
        this.sessionId = sessionId;
        this.sequence = sequence;
        this.senderRole = senderRole;
        this.kind = kind;
        this.priority = priority;
        this.payload = payload == null ? "" : payload;
        this.encrypted = encrypted;
        this.compressed = compressed;
        this.sentAt = sentAt;
        this.status = DeliveryStatus.QUEUED;
    }

    public MessageId id() {
        return id;
    }

    public SessionId sessionId() {
        return sessionId;
    }

    public long sequence() {
        return sequence;
    }

    public Role senderRole() {
        return senderRole;
    }

    public MessageKind kind() {
        return kind;
    }

    public MessagePriority priority() {
        return priority;
    }

    public String payload() {
        return payload;
    }

    public boolean encrypted() {
        return encrypted;
    }

    public boolean compressed() {
        return compressed;
    }

    public Instant sentAt() {
        return sentAt;
    }

    public int payloadBytes() {
        return payload.length();
    }

    public synchronized DeliveryStatus status() {
        return status;
    }

    public synchronized int retryCount() {
        return retryCount;
    }

    public synchronized Instant acknowledgedAt() {
        return acknowledgedAt;
    }

    public synchronized boolean markSent() {
        if (status == DeliveryStatus.ACKNOWLEDGED || status == DeliveryStatus.FAILED) {
            return false;
        }
        status = DeliveryStatus.SENT;
        return true;
    }

    public synchronized boolean markAcknowledged(Instant at) {
        if (status == DeliveryStatus.ACKNOWLEDGED || status == DeliveryStatus.FAILED) {
            return false;
        }
        status = DeliveryStatus.ACKNOWLEDGED;
        acknowledgedAt = at;
        return true;
    }

    public synchronized boolean markFailed() {
        if (status == DeliveryStatus.ACKNOWLEDGED) {
            return false;
        }
        status = DeliveryStatus.FAILED;
        return true;
    }

    public synchronized boolean markQueued() {
        if (status == DeliveryStatus.ACKNOWLEDGED || status == DeliveryStatus.FAILED) {
            return false;
        }
        status = DeliveryStatus.QUEUED;
        return true;
    }

    public synchronized int incrementRetry() {
        return ++retryCount;
    }

    @Override
    public String toString() {
        return "CrisisMessage{" + id + ", session=" + sessionId + ", seq=" + sequence + ", kind=" + kind
                + ", priority=" + priority + ", status=" + status() + "}";
    }
}
