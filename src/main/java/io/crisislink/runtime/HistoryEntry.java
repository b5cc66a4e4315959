package io.crisislink.runtime;

import io.crisislink.model.DeliveryStatus;
import io.crisislink.model.MessageKind;
import io.crisislink.model.MessagePriority;
import io.crisislink.model.Role;

import java.time.Instant;

/** A session message with its content decoded for reading. */
public record HistoryEntry(
        String messageId,
        long sequence,
        Role senderRole,
        MessageKind kind,
        MessagePriority priority,
        String content,
        DeliveryStatus status,
        int retryCount,
        Instant sentAt
) {
}
