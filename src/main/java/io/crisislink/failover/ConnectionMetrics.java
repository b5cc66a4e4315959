package io.crisislink.failover;

import io.crisislink.model.ConnectionId;

public record ConnectionMetrics(
        ConnectionId connectionId,
        String transport,
        long handshakeMs,
        boolean failedOver,
        int attempts,
        boolean withinBudget
) {
}
