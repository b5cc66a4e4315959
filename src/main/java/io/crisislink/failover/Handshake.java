package io.crisislink.failover;

import io.crisislink.transport.Transport;

/** Result of opening a link, before the connection is admitted. */
public record Handshake(
        Transport transport,
        long handshakeMs,
        boolean failedOver,
        int attempts
) {
}
