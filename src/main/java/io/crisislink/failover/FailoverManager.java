package io.crisislink.failover;

import io.crisislink.config.CrisisLinkSettings;
import io.crisislink.error.CrisisLinkException;
import io.crisislink.event.EventBus;
import io.crisislink.event.SessionEvent;
import io.crisislink.model.ConnectionId;
import io.crisislink.model.ConnectionInfo;
import io.crisislink.registry.Connection;
import io.crisislink.registry.ConnectionRegistry;
import io.crisislink.transport.Transport;
import io.crisislink.transport.TransportException;
import io.crisislink.transport.TransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Opens links with primary-then-secondary failover, watches them with heartbeats and
 * rebuilds them after a loss.
 * <p>
 * The primary transport gets {@code connectionTimeoutMs}; the secondary gets whatever
 * remains of {@code failoverWindowMs}. A reconnect loop runs at most once per
 * connection at a time.
 */
public final class FailoverManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FailoverManager.class);
    public static final String RECONNECT_EXHAUSTED = "reconnect_exhausted";

    private final CrisisLinkSettings settings;
    private final TransportFactory primary;
    private final TransportFactory secondary;
    private final ConnectionRegistry registry;
    private final EventBus events;
    private final LoadMonitor loadMonitor;
    private final Executor handshakes;
    private final ScheduledExecutorService scheduler;
    private final LongSupplier clock;
    private final Map<ConnectionId, ScheduledFuture<?>> heartbeats = new ConcurrentHashMap<>();
    private final Set<ConnectionId> reconnecting = ConcurrentHashMap.newKeySet();
    private final Set<ConnectionId> exhausted = ConcurrentHashMap.newKeySet();
    private volatile BiConsumer<ConnectionId, String> linkDownHandler = (id, reason) -> {
    };
    private volatile Consumer<ConnectionId> reconnectedHandler = id -> {
    };
    private volatile Consumer<ConnectionId> exhaustedHandler = id -> {
    };

    public FailoverManager(
            CrisisLinkSettings settings,
            TransportFactory primary,
            TransportFactory secondary,
            ConnectionRegistry registry,
            EventBus events,
            LoadMonitor loadMonitor,
            Executor handshakes,
            ScheduledExecutorService scheduler,
            LongSupplier clock
    ) {
        this.settings = settings;
        this.primary = primary;
        this.secondary = secondary;
        this.registry = registry;
        this.events = events;
        this.loadMonitor = loadMonitor;
        this.handshakes = handshakes;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public void onLinkDown(BiConsumer<ConnectionId, String> handler) {
        this.linkDownHandler = handler;
    }

    public void onReconnected(Consumer<ConnectionId> handler) {
        this.reconnectedHandler = handler;
    }

    /** Called once a link has used up its reconnect attempts. */
    public void onExhausted(Consumer<ConnectionId> handler) {
        this.exhaustedHandler = handler;
    }

    /**
     * Opens a link for the participant. Throws {@code HANDSHAKE_TIMEOUT} when neither
     * transport answers in time; a link that answers after its window is closed.
     */
    public Handshake establish(ConnectionInfo info) {
        long startNanos = System.nanoTime();
        int attempts = 1;
        Exception primaryError;
        try {
            Transport transport = open(primary, info, settings.connectionTimeoutMs());
            return succeeded(transport, startNanos, false, attempts);
        } catch (Exception e) {
            primaryError = e;
            logger.warn("Primary transport {} failed for {}: {}", primary.name(), info.participantId(), describe(e));
        }
        if (secondary != null) {
            attempts++;
            long remaining = settings.failoverWindowMs() - elapsedMs(startNanos);
            try {
                Transport transport = open(secondary, info, Math.max(1L, remaining));
                logger.info("Failed over to {} for {}", secondary.name(), info.participantId());
                return succeeded(transport, startNanos, true, attempts);
            } catch (Exception e) {
                logger.warn("Secondary transport {} failed for {}: {}", secondary.name(), info.participantId(), describe(e));
                primaryError.addSuppressed(e);
            }
        }
        long elapsed = elapsedMs(startNanos);
        loadMonitor.recordConnection(false, elapsed);
        throw CrisisLinkException.handshakeTimeout(info.participantId(), elapsed, primaryError);
    }

    /** Starts heartbeats for an admitted connection. */
    public void watch(ConnectionId connectionId) {
        long interval = settings.heartbeatIntervalMs();
        try {
            ScheduledFuture<?> task = scheduler.scheduleAtFixedRate(
                    () -> heartbeat(connectionId),
                    interval,
                    interval,
                    TimeUnit.MILLISECONDS
            );
            ScheduledFuture<?> previous = heartbeats.put(connectionId, task);
            if (previous != null) {
                previous.cancel(false);
            }
        } catch (RejectedExecutionException e) {
            logger.warn("Scheduler rejected heartbeat for {}", connectionId);
        }
    }

    /** Stops heartbeats and abandons any reconnect loop for the connection. */
    public void unwatch(ConnectionId connectionId) {
        ScheduledFuture<?> task = heartbeats.remove(connectionId);
        if (task != null) {
            task.cancel(false);
        }
        reconnecting.remove(connectionId);
        exhausted.remove(connectionId);
    }

    /**
     * Handles a lost link: publishes DISCONNECTED and starts reconnecting. Repeated
     * reports while a reconnect loop is running, or after it gave up, are ignored.
     */
    public void linkLost(ConnectionId connectionId, String reason) {
        if (registry.lookup(connectionId).isEmpty()
                || exhausted.contains(connectionId)
                || !reconnecting.add(connectionId)) {
            return;
        }
        logger.warn("Link lost for {}: {}", connectionId, reason);
        events.publish(new SessionEvent.Disconnected(now(), connectionId, reason));
        linkDownHandler.accept(connectionId, reason);
        if (settings.maxReconnectAttempts() <= 0) {
            giveUp(connectionId, 0);
            return;
        }
        scheduleReconnect(connectionId, 1);
    }

    public boolean isReconnecting(ConnectionId connectionId) {
        return reconnecting.contains(connectionId);
    }

    public boolean isExhausted(ConnectionId connectionId) {
        return exhausted.contains(connectionId);
    }

    public int watchedCount() {
        return heartbeats.size();
    }

    @Override
    public void close() {
        heartbeats.values().forEach(task -> task.cancel(false));
        heartbeats.clear();
        reconnecting.clear();
        exhausted.clear();
    }

    private Handshake succeeded(Transport transport, long startNanos, boolean failedOver, int attempts) {
        long elapsed = elapsedMs(startNanos);
        loadMonitor.recordConnection(true, elapsed);
        if (elapsed >= settings.handshakeBudgetMs()) {
            logger.debug("Handshake over {} took {}ms (budget {}ms)", transport.name(), elapsed, settings.handshakeBudgetMs());
        }
        return new Handshake(transport, elapsed, failedOver, attempts);
    }

    private Transport open(TransportFactory factory, ConnectionInfo info, long timeoutMs) throws Exception {
        CompletableFuture<Transport> pending = new CompletableFuture<>();
        handshakes.execute(() -> {
            try {
                pending.complete(factory.open(info));
            } catch (TransportException | RuntimeException e) {
                pending.completeExceptionally(e);
            }
        });
        try {
            return pending.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.whenComplete((late, error) -> {
                if (late != null) {
                    logger.debug("Closing late {} link for {}", factory.name(), info.participantId());
                    late.close();
                }
            });
            throw new TimeoutException(factory.name() + " handshake exceeded " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }

    private void heartbeat(ConnectionId connectionId) {
        Optional<Connection> connection = registry.lookup(connectionId);
        if (connection.isEmpty()) {
            unwatch(connectionId);
            return;
        }
        if (reconnecting.contains(connectionId) || exhausted.contains(connectionId)) {
            return;
        }
        Transport transport = connection.get().transport();
        boolean alive;
        try {
            alive = transport != null && transport.ping();
        } catch (RuntimeException e) {
            alive = false;
        }
        if (!alive) {
            linkLost(connectionId, "heartbeat_failed");
        }
    }

    private void scheduleReconnect(ConnectionId connectionId, int attempt) {
        try {
            scheduler.schedule(
                    () -> handshakes.execute(() -> reconnect(connectionId, attempt)),
                    settings.reconnectIntervalMs(),
                    TimeUnit.MILLISECONDS
            );
        } catch (RejectedExecutionException e) {
            reconnecting.remove(connectionId);
            logger.warn("Scheduler rejected reconnect for {}", connectionId);
        }
    }

    private void reconnect(ConnectionId connectionId, int attempt) {
        if (!reconnecting.contains(connectionId)) {
            return;
        }
        Optional<Connection> connection = registry.lookup(connectionId);
        if (connection.isEmpty()) {
            reconnecting.remove(connectionId);
            return;
        }
        events.publish(new SessionEvent.Reconnecting(now(), connectionId, attempt));
        try {
            Handshake handshake = establish(connection.get().info());
            if (!reconnecting.contains(connectionId) || registry.lookup(connectionId).isEmpty()) {
                handshake.transport().close();
                return;
            }
            registry.rebind(connectionId, handshake.transport()).ifPresent(Transport::close);
            reconnecting.remove(connectionId);
            logger.info("Reconnected {} over {} on attempt {}", connectionId, handshake.transport().name(), attempt);
            events.publish(new SessionEvent.Connected(now(), connectionId, handshake.transport().name()));
            reconnectedHandler.accept(connectionId);
        } catch (CrisisLinkException e) {
            if (attempt >= settings.maxReconnectAttempts()) {
                giveUp(connectionId, attempt);
                return;
            }
            scheduleReconnect(connectionId, attempt + 1);
        }
    }

    private void giveUp(ConnectionId connectionId, int attempts) {
        exhausted.add(connectionId);
        reconnecting.remove(connectionId);
        logger.warn("Giving up on {} after {} reconnect attempts", connectionId, attempts);
        exhaustedHandler.accept(connectionId);
        events.publish(new SessionEvent.Disconnected(now(), connectionId, RECONNECT_EXHAUSTED));
    }

    private Instant now() {
        return Instant.ofEpochMilli(clock.getAsLong());
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
