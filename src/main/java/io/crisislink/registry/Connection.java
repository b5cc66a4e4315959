package io.crisislink.registry;

import io.crisislink.model.ConnectionId;
import io.crisislink.model.ConnectionInfo;
import io.crisislink.model.Role;
import io.crisislink.transport.Transport;

import java.time.Instant;

public record Connection(
        ConnectionId id,
        ConnectionInfo info,
        Instant connectedAt,
        long lastActivityMs,
        Transport transport
) {
    public Role role() {
        return info.role();
    }

    public String participantId() {
        return info.participantId();
    }

    public String transportName() {
        return transport == null ? "none" : transport.name();
    }

    Connection withTransport(Transport next) {
        return new Connection(id, info, connectedAt, lastActivityMs, next);
    }

    Connection withActivity(long nowMs) {
        return new Connection(id, info, connectedAt, nowMs, transport);
    }
}
