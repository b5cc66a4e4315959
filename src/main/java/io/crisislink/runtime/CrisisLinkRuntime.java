package io.crisislink.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.crisislink.config.CrisisLinkConfig;
import io.crisislink.config.CrisisLinkSettings;
import io.crisislink.delivery.DeliveryPipeline;
import io.crisislink.delivery.DeliveryStats;
import io.crisislink.delivery.PayloadCodec;
import io.crisislink.error.CrisisLinkException;
import io.crisislink.escalation.EscalationService;
import io.crisislink.escalation.EscalationStats;
import io.crisislink.escalation.LoggingNotificationGateway;
import io.crisislink.escalation.NotificationGateway;
import io.crisislink.escalation.ScriptNotificationGateway;
import io.crisislink.event.EventBus;
import io.crisislink.event.SessionEvent;
import io.crisislink.failover.ConnectionMetrics;
import io.crisislink.failover.FailoverManager;
import io.crisislink.failover.Handshake;
import io.crisislink.failover.LoadMonitor;
import io.crisislink.failover.LoadReport;
import io.crisislink.failover.Stability;
import io.crisislink.model.ConnectionId;
import io.crisislink.model.ConnectionInfo;
import io.crisislink.model.CrisisMessage;
import io.crisislink.model.DeliveryOptions;
import io.crisislink.model.DeliveryReceipt;
import io.crisislink.model.EscalationEvent;
import io.crisislink.model.Feedback;
import io.crisislink.model.MessageKind;
import io.crisislink.model.MessagePriority;
import io.crisislink.model.Role;
import io.crisislink.model.SessionId;
import io.crisislink.model.SessionRequest;
import io.crisislink.model.SessionSummary;
import io.crisislink.model.VolunteerProfile;
import io.crisislink.model.VolunteerRequest;
import io.crisislink.observability.AuditLogger;
import io.crisislink.observability.LatencyRecorder;
import io.crisislink.observability.PrometheusFormatter;
import io.crisislink.registry.Connection;
import io.crisislink.registry.ConnectionRegistry;
import io.crisislink.resilience.CircuitBreakerRegistry;
import io.crisislink.resilience.CircuitState;
import io.crisislink.resilience.RateLimiter;
import io.crisislink.security.PayloadCrypto;
import io.crisislink.session.CrisisSession;
import io.crisislink.session.SessionManager;
import io.crisislink.session.VolunteerMatcher;
import io.crisislink.storage.AsyncPersistence;
import io.crisislink.storage.SessionStore;
import io.crisislink.storage.SqliteSessionStore;
import io.crisislink.storage.StoredMessage;
import io.crisislink.transport.LoopbackTransportFactory;
import io.crisislink.transport.Transport;
import io.crisislink.transport.TransportFactory;
import io.crisislink.util.Jsons;
import io.crisislink.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * Entry point for clients of the crisis service. Owns the worker pools and wires the
 * registry, session manager, delivery pipeline, escalation service and failover
 * manager together. Every public operation is safe to call from any thread.
 */
public final class CrisisLinkRuntime implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CrisisLinkRuntime.class);
    static final int RISK_FLAG_ESCALATION_THRESHOLD = 3;
    private static final long DEFAULT_NOTIFY_COMMAND_TIMEOUT_MS = 120L;

    private final CrisisLinkConfig config;
    private final CrisisLinkSettings settings;
    private final LongSupplier clock;
    private final ExecutorService workers;
    private final ExecutorService fanout;
    private final ExecutorService handshakes;
    private final ScheduledExecutorService scheduler;
    private final EventBus events;
    private final ConnectionRegistry registry;
    private final RateLimiter rateLimiter;
    private final CircuitBreakerRegistry breakers;
    private final LoadMonitor loadMonitor;
    private final SessionManager sessions;
    private final AsyncPersistence persistence;
    private final AuditLogger auditLogger;
    private final PayloadCrypto payloadCrypto;
    private final DeliveryPipeline pipeline;
    private final EscalationService escalations;
    private final FailoverManager failover;
    private final AtomicBoolean closed = new AtomicBoolean();

    public CrisisLinkRuntime(
            CrisisLinkConfig config,
            CrisisLinkSettings settings,
            SessionStore store,
            NotificationGateway gateway,
            TransportFactory primary,
            TransportFactory secondary,
            LongSupplier clock
    ) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        int workerThreads = Math.max(8, Runtime.getRuntime().availableProcessors() * 2);
        this.workers = Executors.newFixedThreadPool(workerThreads, new NamedThreadFactory("crisislink-worker"));
        this.fanout = Executors.newCachedThreadPool(new NamedThreadFactory("crisislink-notify"));
        this.handshakes = Executors.newCachedThreadPool(new NamedThreadFactory("crisislink-handshake"));
        this.scheduler = Executors.newScheduledThreadPool(2, new NamedThreadFactory("crisislink-scheduler"));
        this.events = new EventBus(workers);
        this.registry = new ConnectionRegistry(settings.maxConnections(), clock);
        this.rateLimiter = new RateLimiter(settings.rateLimit(), clock);
        this.breakers = new CircuitBreakerRegistry(settings, clock);
        this.loadMonitor = new LoadMonitor();
        this.sessions = new SessionManager(settings, new VolunteerMatcher(settings.volunteerCapacity()), events, scheduler, clock);
        this.persistence = new AsyncPersistence(store);
        this.auditLogger = AuditLogger.open(config.auditFile(), config.auditSigningKeyFile());
        this.payloadCrypto = new PayloadCrypto(config.payloadKeyFile());
        this.pipeline = new DeliveryPipeline(
                settings,
                registry,
                events,
                rateLimiter,
                new PayloadCodec(payloadCrypto, settings.compressionEnabled()),
                persistence,
                loadMonitor,
                workers,
                scheduler,
                clock
        );
        this.escalations = new EscalationService(settings, breakers, gateway, events, auditLogger, persistence, fanout, clock);
        this.failover = new FailoverManager(settings, primary, secondary, registry, events, loadMonitor, handshakes, scheduler, clock);

        pipeline.onLinkLost(id -> failover.linkLost(id, "link_unavailable"));
        failover.onLinkDown(pipeline::suspendLink);
        failover.onReconnected(pipeline::resumeLink);
        failover.onExhausted(id -> pipeline.abandonLink(id, FailoverManager.RECONNECT_EXHAUSTED));
        events.subscribe(event -> {
            if (event instanceof SessionEvent.SessionMatched matched) {
                pipeline.recipientsChanged(matched.sessionId());
            }
        });
        sessions.onExpiry(this::expire);
    }

    /**
     * Opens a runtime over the on-disk layout under {@code config.rootDir()}: settings
     * file, SQLite store, audit log and keyrings. Links are in-process.
     */
    public static CrisisLinkRuntime open(CrisisLinkConfig config) {
        CrisisLinkSettings settings = CrisisLinkSettings.load(config.settingsFile());
        SqliteSessionStore store = new SqliteSessionStore(config);
        store.init();
        return new CrisisLinkRuntime(
                config,
                settings,
                store,
                loadGateway(config),
                new LoopbackTransportFactory("primary"),
                new LoopbackTransportFactory("secondary"),
                System::currentTimeMillis
        );
    }

    public CrisisLinkSettings settings() {
        return settings;
    }

    public CrisisLinkConfig config() {
        return config;
    }

    // ---- connections ----

    /**
     * Performs the handshake and admits the participant. Throws
     * {@code HANDSHAKE_TIMEOUT}, {@code ALREADY_CONNECTED}, {@code CAPACITY_EXCEEDED}
     * or {@code AUTHENTICATION_REJECTED}; on any failure nothing stays registered.
     */
    public ConnectionMetrics connect(ConnectionInfo info) {
        long startNanos = System.nanoTime();
        Handshake handshake = failover.establish(info);
        Connection connection;
        try {
            connection = registry.admit(info, handshake.transport());
        } catch (CrisisLinkException e) {
            handshake.transport().close();
            throw e;
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        failover.watch(connection.id());
        events.publish(new SessionEvent.Connected(now(), connection.id(), handshake.transport().name()));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("role", info.role().name());
        details.put("transport", handshake.transport().name());
        details.put("failed_over", handshake.failedOver());
        details.put("handshake_ms", elapsedMs);
        auditLogger.log(AuditLogger.AuditEvent.forConnection("connection.open", connection.id(), "ok", details));
        return new ConnectionMetrics(
                connection.id(),
                handshake.transport().name(),
                elapsedMs,
                handshake.failedOver(),
                handshake.attempts(),
                elapsedMs < settings.handshakeBudgetMs()
        );
    }

    /**
     * Removes the connection. A person's open session ends; a volunteer's sessions go
     * back to the wait queue. Returns {@code false} if the connection was unknown.
     */
    public boolean disconnect(ConnectionId connectionId, String reason) {
        Optional<Connection> removed = registry.remove(connectionId);
        if (removed.isEmpty()) {
            return false;
        }
        Connection connection = removed.get();
        String why = reason == null || reason.isBlank() ? "client_closed" : reason;
        failover.unwatch(connectionId);
        rateLimiter.forget(connectionId);
        if (connection.transport() != null) {
            connection.transport().close();
        }
        events.publish(new SessionEvent.Disconnected(now(), connectionId, why));
        if (connection.role() == Role.PERSON_IN_CRISIS) {
            for (CrisisSession session : sessions.sessionsInvolving(connectionId)) {
                endSession(session.id(), Feedback.none(), "disconnected");
            }
        } else {
            sessions.volunteerDisconnected(connectionId);
        }
        auditLogger.log(AuditLogger.AuditEvent.forConnection("connection.close", connectionId, "ok", Map.of("reason", why)));
        logger.info("Disconnected {} ({})", connectionId, why);
        return true;
    }

    public Optional<Connection> connection(ConnectionId connectionId) {
        return registry.lookup(connectionId);
    }

    // ---- sessions ----

    /**
     * Starts a session for a connected person. High-severity and emergency sessions are
     * escalated before this returns. While load stability is FAILED only emergency or
     * high-severity intakes are accepted.
     */
    public CrisisSession startSession(ConnectionId personConnection, SessionRequest request) {
        Connection person = registry.lookup(personConnection)
                .orElseThrow(() -> CrisisLinkException.invalidRequest("unknown connection: " + personConnection));
        boolean urgent = request.emergency() || request.severity() >= settings.escalationSeverityThreshold();
        if (!urgent && loadMonitor.stability() == Stability.FAILED) {
            throw CrisisLinkException.capacityExceeded("session intake while load is FAILED", registry.maxConnections());
        }
        CrisisSession session = sessions.start(person, request);
        registry.touch(personConnection);
        auditLogger.log(AuditLogger.AuditEvent.forSession(
                "session.start",
                "system",
                session.id(),
                "ok",
                null,
                Map.of("severity", request.severity(), "emergency", request.emergency(), "anonymous", request.anonymous())
        ));
        if (request.emergency()) {
            escalations.triggerEmergency(session, "emergency at intake");
        } else if (urgent) {
            escalations.escalate(session, request.severity(), "severity " + request.severity() + " at intake");
        }
        return session;
    }

    public CrisisSession session(SessionId sessionId) {
        return sessions.require(sessionId);
    }

    public int requestVolunteer(SessionId sessionId, VolunteerRequest request) {
        return sessions.requestVolunteer(sessionId, request == null ? VolunteerRequest.any() : request);
    }

    public void registerVolunteer(ConnectionId volunteerConnection, VolunteerProfile profile) {
        Connection volunteer = registry.lookup(volunteerConnection)
                .orElseThrow(() -> CrisisLinkException.invalidRequest("unknown connection: " + volunteerConnection));
        sessions.registerVolunteer(volunteer, profile == null ? VolunteerProfile.general() : profile);
    }

    public void matchVolunteer(SessionId sessionId, ConnectionId volunteerConnection) {
        registry.lookup(volunteerConnection)
                .filter(c -> c.role() != Role.PERSON_IN_CRISIS)
                .orElseThrow(() -> CrisisLinkException.invalidRequest("not a volunteer connection: " + volunteerConnection));
        sessions.matchVolunteer(sessionId, volunteerConnection);
    }

    public EscalationEvent triggerEmergency(SessionId sessionId, String reason) {
        CrisisSession session = sessions.require(sessionId);
        requireOpen(session);
        return escalations.triggerEmergency(session, reason);
    }

    /** Escalates to {@code severity}; empty when the session is already escalated at or above it. */
    public Optional<EscalationEvent> escalate(SessionId sessionId, int severity) {
        CrisisSession session = sessions.require(sessionId);
        requireOpen(session);
        return escalations.escalate(session, severity, "severity raised to " + severity);
    }

    /**
     * Counts a high-risk signal on the session. The third flag escalates the session to
     * the escalation threshold. Returns the running total.
     */
    public int flagRisk(SessionId sessionId) {
        CrisisSession session = sessions.require(sessionId);
        requireOpen(session);
        int flags = sessions.flagRisk(sessionId);
        if (flags >= RISK_FLAG_ESCALATION_THRESHOLD) {
            escalations.escalate(
                    session,
                    Math.max(session.severity(), settings.escalationSeverityThreshold()),
                    flags + " risk flags"
            );
        }
        return flags;
    }

    public void resolveSession(SessionId sessionId) {
        sessions.resolve(sessionId);
        auditLogger.log(AuditLogger.AuditEvent.forSession("session.resolve", "system", sessionId, "ok", null, Map.of()));
    }

    public SessionSummary endSession(SessionId sessionId, Feedback feedback) {
        return endSession(sessionId, feedback, "completed");
    }

    /**
     * Ends the session: timers stop, the outbox drains (bounded), the summary is
     * persisted and SESSION_ENDED is published. Ending an ended session returns its
     * summary again.
     */
    public SessionSummary endSession(SessionId sessionId, Feedback feedback, String reason) {
        Optional<CrisisSession> ended = sessions.end(sessionId, reason, feedback);
        if (ended.isEmpty()) {
            return sessions.require(sessionId).summary();
        }
        CrisisSession session = ended.get();
        drainOutbox(sessionId);
        SessionSummary summary = session.summary();
        persistence.saveSessionSummary(summary);
        events.publish(new SessionEvent.SessionEnded(now(), sessionId, summary));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("messages", summary.messageCount());
        details.put("escalations", summary.escalationCount());
        details.put("duration_ms", summary.durationMs());
        if (summary.rating() != null) {
            details.put("rating", summary.rating());
        }
        auditLogger.log(AuditLogger.AuditEvent.forSession("session.end", "system", sessionId, "ok", null, details));
        return summary;
    }

    // ---- messages ----

    /**
     * Sends a chat message and waits for its receipt. Emergency messages escalate the
     * session. Throws {@code DELIVERY_FAILED} when the retry budget is spent and
     * {@code RATE_LIMITED} when the sender or the outbox is over its limit.
     */
    public DeliveryReceipt sendMessage(SessionId sessionId, Role senderRole, String content, DeliveryOptions options) {
        return await(submitMessage(sessionId, senderRole, content, options));
    }

    public CompletableFuture<DeliveryReceipt> submitMessage(
            SessionId sessionId,
            Role senderRole,
            String content,
            DeliveryOptions options
    ) {
        CrisisSession session = sessions.require(sessionId);
        DeliveryOptions opts = options == null ? DeliveryOptions.standard() : options;
        ConnectionId sender = senderFor(session, senderRole);
        CompletableFuture<DeliveryReceipt> receipt = pipeline.submit(session, sender, senderRole, MessageKind.CHAT, content, opts);
        if (opts.emergency() || opts.priority() == MessagePriority.EMERGENCY) {
            escalations.escalate(
                    session,
                    Math.max(session.severity(), settings.escalationSeverityThreshold()),
                    "emergency message"
            );
        }
        return receipt;
    }

    /** Best-effort typing signal; the receipt is FAILED rather than an error when it cannot go out. */
    public DeliveryReceipt setTyping(SessionId sessionId, Role senderRole, boolean typing) {
        CrisisSession session = sessions.require(sessionId);
        ConnectionId sender = senderFor(session, senderRole);
        return await(pipeline.submit(
                session,
                sender,
                senderRole,
                MessageKind.TYPING,
                Boolean.toString(typing),
                DeliveryOptions.withPriority(MessagePriority.LOW)
        ));
    }

    public EventBus.Subscription subscribe(Consumer<SessionEvent> listener) {
        return events.subscribe(listener);
    }

    public EventBus.Subscription subscribe(Predicate<SessionEvent> filter, Consumer<SessionEvent> listener) {
        return events.subscribe(filter, listener);
    }

    /**
     * Decoded message history. Live sessions are read from memory, older ones from the
     * store.
     */
    public List<HistoryEntry> history(SessionId sessionId) {
        Optional<CrisisSession> live = sessions.find(sessionId);
        List<HistoryEntry> out = new ArrayList<>();
        if (live.isPresent()) {
            for (CrisisMessage message : live.get().history()) {
                out.add(new HistoryEntry(
                        message.id().toString(),
                        message.sequence(),
                        message.senderRole(),
                        message.kind(),
                        message.priority(),
                        readable(message.id().toString(), message.payload(), message.encrypted(), message.compressed()),
                        message.status(),
                        message.retryCount(),
                        message.sentAt()
                ));
            }
            return out;
        }
        persistence.flush(5_000L);
        List<StoredMessage> stored = persistence.store().loadSessionHistory(sessionId);
        if (stored.isEmpty() && persistence.store().loadSessionSummary(sessionId).isEmpty()) {
            throw CrisisLinkException.sessionNotFound(sessionId);
        }
        for (StoredMessage message : stored) {
            out.add(new HistoryEntry(
                    message.messageId(),
                    message.sequence(),
                    message.senderRole(),
                    message.kind(),
                    message.priority(),
                    readable(message.messageId(), message.payload(), message.encrypted(), message.compressed()),
                    message.status(),
                    message.retryCount(),
                    Instant.ofEpochMilli(message.sentAtMs())
            ));
        }
        return out;
    }

    // ---- observability ----

    public StatsSnapshot stats() {
        Map<String, Integer> byRole = new LinkedHashMap<>();
        registry.countByRole().forEach((role, count) -> byRole.put(role.name(), count));
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        sessions.countByStatus().forEach((status, count) -> byStatus.put(status.name(), count));
        Map<String, Long> byLevel = new LinkedHashMap<>();
        EscalationStats escalationStats = escalations.stats();
        escalationStats.byLevel().forEach((level, count) -> byLevel.put(level.name(), count));
        Map<String, String> circuits = new LinkedHashMap<>();
        breakers.states().forEach((name, state) -> circuits.put(name, state.name()));
        DeliveryStats delivery = pipeline.stats();
        LatencyRecorder.Snapshot latency = delivery.latency();
        LoadReport load = loadMonitor.report();
        return new StatsSnapshot(
                registry.count(),
                registry.maxConnections(),
                byRole,
                registry.admittedTotal(),
                registry.rejectedTotal(),
                byStatus,
                sessions.matcher().waitingCount(),
                sessions.matcher().availableVolunteers(),
                delivery.delivered(),
                delivery.failed(),
                delivery.queuedOffline(),
                delivery.droppedBestEffort(),
                delivery.pending(),
                latency.p50Ms(),
                latency.p95Ms(),
                latency.p99Ms(),
                latency.withinBudgetRatio(),
                escalationStats.total(),
                byLevel,
                escalationStats.averageElapsedMs(),
                escalationStats.maxElapsedMs(),
                escalationStats.channelFailures(),
                circuits,
                breakers.openCount(),
                rateLimiter.rejectedTotal(),
                rateLimiter.warningsTotal(),
                load.connectionSuccessRate(),
                load.deliveryRate(),
                load.averageHandshakeMs(),
                load.stability().name(),
                events.publishedCount(),
                events.listenerFailures(),
                persistence.writtenTotal(),
                persistence.failedTotal()
        );
    }

    public String metricsText() {
        String text = PrometheusFormatter.format(stats());
        auditLogger.log(AuditLogger.AuditEvent.system("runtime.metrics", "ok", Map.of("bytes", text.length())));
        return text;
    }

    public LoadReport loadReport() {
        return loadMonitor.report();
    }

    public DeliveryStats deliveryStats() {
        return pipeline.stats();
    }

    public EscalationStats escalationStats() {
        return escalations.stats();
    }

    public Map<String, CircuitState> circuitStates() {
        return breakers.states();
    }

    public List<String> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    public AuditLogger.Integrity verifyAudit(int limit) {
        return auditLogger.verify(limit);
    }

    public PayloadCrypto.KeyringStatus payloadKeyStatus() {
        return payloadCrypto.status();
    }

    public PayloadCrypto.KeyringStatus rotatePayloadKey() {
        PayloadCrypto.KeyringStatus out = payloadCrypto.rotate();
        auditLogger.log(AuditLogger.AuditEvent.system(
                "payload.key.rotate",
                "ok",
                Map.of("active_kid", out.activeKid(), "total_keys", out.totalKeys())
        ));
        return out;
    }

    /** Waits for queued store writes; for tests and the CLI. */
    public boolean flushPersistence(long timeoutMs) {
        return persistence.flush(timeoutMs);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        failover.close();
        pipeline.close();
        scheduler.shutdownNow();
        shutdown(workers, "workers");
        fanout.shutdownNow();
        handshakes.shutdownNow();
        persistence.close();
        for (Connection connection : registry.all()) {
            Transport transport = connection.transport();
            if (transport != null) {
                transport.close();
            }
        }
        logger.info("Runtime closed");
    }

    private void expire(SessionId sessionId, String trigger) {
        workers.execute(() -> {
            try {
                logger.info("Session {} timed out ({})", sessionId, trigger);
                endSession(sessionId, Feedback.none(), "timeout");
            } catch (CrisisLinkException e) {
                logger.warn("Could not end timed out session {}: {}", sessionId, e.getMessage());
            }
        });
    }

    private void drainOutbox(SessionId sessionId) {
        CompletableFuture<Void> drained = pipeline.close(sessionId);
        try {
            drained.get(pipeline.drainTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Outbox of session {} did not drain in {}ms, failing the rest", sessionId, pipeline.drainTimeoutMs());
            pipeline.forceClose(sessionId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pipeline.forceClose(sessionId);
        } catch (ExecutionException e) {
            throw new RuntimeException("Failed to drain outbox of session " + sessionId, e.getCause());
        }
    }

    private ConnectionId senderFor(CrisisSession session, Role role) {
        if (role == Role.PERSON_IN_CRISIS) {
            return session.personConnection();
        }
        return session.volunteerConnection()
                .orElseThrow(() -> CrisisLinkException.invalidState("session " + session.id() + " has no volunteer yet"));
    }

    private static void requireOpen(CrisisSession session) {
        if (!session.isOpen()) {
            throw CrisisLinkException.invalidState("session " + session.id() + " is " + session.status());
        }
    }

    private String readable(String messageId, String payload, boolean encrypted, boolean compressed) {
        try {
            return pipeline.codec().decode(payload, encrypted, compressed);
        } catch (RuntimeException e) {
            logger.warn("Cannot decode payload of {}: {}", messageId, e.getMessage());
            return "[unreadable]";
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof CrisisLinkException crisis) {
                throw crisis;
            }
            throw e;
        }
    }

    private static void shutdown(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Executor {} did not stop in time", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static NotificationGateway loadGateway(CrisisLinkConfig config) {
        Path file = config.notifyCommandFile();
        if (!Files.exists(file)) {
            return new LoggingNotificationGateway();
        }
        try {
            NotifyCommandFile notify = Jsons.mapper().readValue(file.toFile(), NotifyCommandFile.class);
            if (notify == null || notify.command() == null || notify.command().isEmpty()) {
                logger.warn("Notify command file {} has no command, logging notifications instead", file);
                return new LoggingNotificationGateway();
            }
            long timeoutMs = notify.timeoutMs() == null ? DEFAULT_NOTIFY_COMMAND_TIMEOUT_MS : notify.timeoutMs();
            return new ScriptNotificationGateway(notify.command(), timeoutMs);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read notify command file: " + file, e);
        }
    }

    private Instant now() {
        return Instant.ofEpochMilli(clock.getAsLong());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record NotifyCommandFile(List<String> command, Long timeoutMs) {
    }
}
