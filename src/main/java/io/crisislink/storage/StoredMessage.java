package io.crisislink.storage;

import io.crisislink.model.DeliveryStatus;
import io.crisislink.model.MessageKind;
import io.crisislink.model.MessagePriority;
import io.crisislink.model.Role;

public record StoredMessage(
        String messageId,
        String sessionId,
        long sequence,
        Role senderRole,
        MessageKind kind,
        MessagePriority priority,
        String payload,
        boolean encrypted,
        boolean compressed,
        DeliveryStatus status,
        int retryCount,
        long sentAtMs
) {
}
