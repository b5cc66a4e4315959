package io.crisislink.registry;

import io.crisislink.error.CrisisLinkException;
import io.crisislink.model.ConnectionId;
import io.crisislink.model.ConnectionInfo;
import io.crisislink.model.Role;
import io.crisislink.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Live connections keyed by id. Admission and removal are serialized so the capacity
 * ceiling and the one-connection-per-participant rule hold under concurrent connects.
 * Lookups are lock-free.
 */
public final class ConnectionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final int maxConnections;
    private final LongSupplier clock;
    private final Map<ConnectionId, Connection> byId = new ConcurrentHashMap<>();
    private final Map<String, ConnectionId> byParticipant = new HashMap<>();
    private final AtomicInteger gauge = new AtomicInteger();
    private final AtomicLong admittedTotal = new AtomicLong();
    private final AtomicLong rejectedTotal = new AtomicLong();

    public ConnectionRegistry(int maxConnections, LongSupplier clock) {
        this.maxConnections = Math.max(1, maxConnections);
        this.clock = clock;
    }

    public Connection admit(ConnectionInfo info, Transport transport) {
        if (info.role().requiresAuthentication() && !info.authenticated()) {
            rejectedTotal.incrementAndGet();
            throw CrisisLinkException.authenticationRejected(info.participantId());
        }
        synchronized (byParticipant) {
            if (byParticipant.containsKey(info.participantId())) {
                rejectedTotal.incrementAndGet();
                throw CrisisLinkException.alreadyConnected(info.participantId());
            }
            if (byId.size() >= maxConnections) {
                rejectedTotal.incrementAndGet();
                logger.warn("Connection capacity reached ({}), rejecting {}", maxConnections, info.participantId());
                throw CrisisLinkException.capacityExceeded("connection", maxConnections);
            }
            long now = clock.getAsLong();
            Connection connection = new Connection(
                    ConnectionId.random(),
                    info,
                    Instant.ofEpochMilli(now),
                    now,
                    transport
            );
            byId.put(connection.id(), connection);
            byParticipant.put(info.participantId(), connection.id());
            gauge.set(byId.size());
            admittedTotal.incrementAndGet();
            logger.debug("Admitted {} as {} ({})", info.participantId(), connection.id(), info.role());
            return connection;
        }
    }

    public Optional<Connection> remove(ConnectionId connectionId) {
        synchronized (byParticipant) {
            Connection removed = byId.remove(connectionId);
            if (removed == null) {
                return Optional.empty();
            }
            byParticipant.remove(removed.participantId(), connectionId);
            gauge.set(byId.size());
            return Optional.of(removed);
        }
    }

    public Optional<Connection> lookup(ConnectionId connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(connectionId));
    }

    public Optional<Transport> transportOf(ConnectionId connectionId) {
        return lookup(connectionId).map(Connection::transport);
    }

    public void touch(ConnectionId connectionId) {
        byId.computeIfPresent(connectionId, (id, current) -> current.withActivity(clock.getAsLong()));
    }

    /** Swaps the live transport after a reconnect; returns the previous one. */
    public Optional<Transport> rebind(ConnectionId connectionId, Transport transport) {
        Transport[] previous = new Transport[1];
        byId.computeIfPresent(connectionId, (id, current) -> {
            previous[0] = current.transport();
            return current.withTransport(transport).withActivity(clock.getAsLong());
        });
        return Optional.ofNullable(previous[0]);
    }

    public int count() {
        return gauge.get();
    }

    public Map<Role, Integer> countByRole() {
        Map<Role, Integer> out = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            out.put(role, 0);
        }
        for (Connection connection : byId.values()) {
            out.merge(connection.role(), 1, Integer::sum);
        }
        return out;
    }

    public Collection<Connection> all() {
        return List.copyOf(byId.values());
    }

    public long admittedTotal() {
        return admittedTotal.get();
    }

    public long rejectedTotal() {
        return rejectedTotal.get();
    }

    public int maxConnections() {
        return maxConnections;
    }
}
