package io.crisislink.model;

import java.time.Instant;

public record DeliveryReceipt(
        MessageId messageId,
        SessionId sessionId,
        long sequence,
        DeliveryStatus status,
        int attempts,
        long latencyMs,
        Instant deliveredAt
) {
    public boolean delivered() {
        return status == DeliveryStatus.ACKNOWLEDGED;
    }

    public boolean queuedOffline() {
        return status == DeliveryStatus.QUEUED;
    }
}
