package io.crisislink.escalation;

import io.crisislink.config.CrisisLinkSettings;
import io.crisislink.error.CrisisLinkException;
import io.crisislink.error.ErrorKind;
import io.crisislink.event.EventBus;
import io.crisislink.event.SessionEvent;
import io.crisislink.model.AlertId;
import io.crisislink.model.ChannelKind;
import io.crisislink.model.ChannelOutcome;
import io.crisislink.model.EmergencyChannel;
import io.crisislink.model.EmergencyResource;
import io.crisislink.model.EscalationEvent;
import io.crisislink.model.EscalationLevel;
import io.crisislink.observability.AuditLogger;
import io.crisislink.observability.LatencyRecorder;
import io.crisislink.observability.TraceIds;
import io.crisislink.resilience.CircuitBreaker;
import io.crisislink.resilience.CircuitBreakerRegistry;
import io.crisislink.session.CrisisSession;
import io.crisislink.storage.AsyncPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Raises sessions to ESCALATED and notifies the emergency channels for the resulting
 * level. Channels are notified in parallel, each behind its own circuit breaker, and
 * the escalation returns once every channel answered or the notify deadline passed.
 * A channel that misses the deadline is recorded as unreached; it never delays the
 * others.
 */
public final class EscalationService {
    private static final Logger logger = LoggerFactory.getLogger(EscalationService.class);
    private static final int LATENCY_SAMPLES = 1024;

    private final CrisisLinkSettings settings;
    private final CircuitBreakerRegistry breakers;
    private final NotificationGateway gateway;
    private final EventBus events;
    private final AuditLogger auditLogger;
    private final AsyncPersistence persistence;
    private final Executor fanout;
    private final LongSupplier clock;
    private final LatencyRecorder latency;
    private final Map<EscalationLevel, AtomicLong> byLevel = new EnumMap<>(EscalationLevel.class);
    private final AtomicLong channelFailures = new AtomicLong();
    private final AtomicLong elapsedTotal = new AtomicLong();

    public EscalationService(
            CrisisLinkSettings settings,
            CircuitBreakerRegistry breakers,
            NotificationGateway gateway,
            EventBus events,
            AuditLogger auditLogger,
            AsyncPersistence persistence,
            Executor fanout,
            LongSupplier clock
    ) {
        this.settings = settings;
        this.breakers = breakers;
        this.gateway = gateway;
        this.events = events;
        this.auditLogger = auditLogger;
        this.persistence = persistence;
        this.fanout = fanout;
        this.clock = clock;
        this.latency = new LatencyRecorder(LATENCY_SAMPLES, settings.escalationBudgetMs());
        for (EscalationLevel level : EscalationLevel.values()) {
            byLevel.put(level, new AtomicLong());
        }
    }

    /**
     * Escalates the session to {@code severity}. Returns empty when the session is
     * already escalated at that severity or higher.
     */
    public Optional<EscalationEvent> escalate(CrisisSession session, int severity, String reason) {
        long startNanos = System.nanoTime();
        if (!session.escalate(severity, clock.getAsLong())) {
            logger.debug("Session {} already escalated at severity {}", session.id(), session.severity());
            return Optional.empty();
        }
        return Optional.of(fanOut(session, reason, startNanos));
    }

    /**
     * Declares an emergency on the session: severity is raised to at least the
     * escalation threshold and the channels are notified even when the session was
     * already escalated.
     */
    public EscalationEvent triggerEmergency(CrisisSession session, String reason) {
        long startNanos = System.nanoTime();
        session.markEmergency();
        session.escalate(Math.max(session.severity(), settings.escalationSeverityThreshold()), clock.getAsLong());
        return fanOut(session, reason, startNanos);
    }

    /** Channels notified at the given severity. Emergency services only at level EMERGENCY. */
    public List<EmergencyChannel> channelsFor(int severity) {
        EscalationLevel level = EscalationLevel.forSeverity(severity);
        List<EmergencyChannel> out = new ArrayList<>();
        for (EmergencyChannel channel : settings.channels()) {
            if (severity < channel.minSeverity()) {
                continue;
            }
            if (channel.kind() == ChannelKind.EMERGENCY_SERVICES && level != EscalationLevel.EMERGENCY) {
                continue;
            }
            out.add(channel);
        }
        return out;
    }

    public EscalationStats stats() {
        Map<EscalationLevel, Long> levels = new EnumMap<>(EscalationLevel.class);
        long total = 0L;
        for (Map.Entry<EscalationLevel, AtomicLong> entry : byLevel.entrySet()) {
            levels.put(entry.getKey(), entry.getValue().get());
            total += entry.getValue().get();
        }
        LatencyRecorder.Snapshot snapshot = latency.snapshot();
        return new EscalationStats(
                total,
                levels,
                total == 0L ? 0.0d : (double) elapsedTotal.get() / total,
                snapshot.maxMs(),
                channelFailures.get(),
                snapshot.withinBudgetRatio()
        );
    }

    private EscalationEvent fanOut(CrisisSession session, String reason, long startNanos) {
        int severity = session.severity();
        EscalationLevel level = EscalationLevel.forSeverity(severity);
        String why = reason == null || reason.isBlank() ? "severity " + severity : reason.trim();
        Instant raisedAt = Instant.ofEpochMilli(clock.getAsLong());
        EscalationNotice notice = new EscalationNotice(
                AlertId.random(),
                session.id(),
                severity,
                level,
                why,
                session.anonymous(),
                TraceIds.newTraceId(),
                raisedAt
        );
        events.publish(new SessionEvent.EmergencyTriggered(raisedAt, session.id(), notice.alertId(), why));
        events.publish(new SessionEvent.EmergencyResources(raisedAt, session.id(), EmergencyResource.forLevel(level)));

        List<EmergencyChannel> targets = channelsFor(severity);
        List<ChannelCall> calls = new ArrayList<>();
        for (EmergencyChannel channel : targets) {
            calls.add(start(channel, notice));
        }
        long deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(settings.notifyDeadlineMs());
        List<ChannelOutcome> outcomes = new ArrayList<>();
        List<String> contacted = new ArrayList<>();
        for (ChannelCall call : calls) {
            ChannelOutcome outcome = await(call, startNanos, deadlineNanos);
            outcomes.add(outcome);
            if (outcome.reached()) {
                contacted.add(outcome.channelId());
            } else {
                channelFailures.incrementAndGet();
                logger.warn("{} on {} for session {}: {}",
                        ErrorKind.ESCALATION_CHANNEL_UNREACHABLE, outcome.channelId(), session.id(), outcome.error());
            }
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        EscalationEvent event = new EscalationEvent(
                notice.alertId(),
                session.id(),
                severity,
                level,
                why,
                outcomes,
                contacted,
                elapsedMs,
                notice.traceId(),
                raisedAt
        );
        latency.record(elapsedMs);
        elapsedTotal.addAndGet(elapsedMs);
        byLevel.get(level).incrementAndGet();
        if (elapsedMs >= settings.escalationBudgetMs()) {
            logger.warn("Escalation {} for session {} took {}ms (budget {}ms)",
                    notice.alertId(), session.id(), elapsedMs, settings.escalationBudgetMs());
        }
        logger.info("Escalated session {} level={} severity={} reached={}/{} in {}ms",
                session.id(), level, severity, contacted.size(), targets.size(), elapsedMs);

        persistence.saveEscalation(event);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("alert_id", notice.alertId().toString());
        details.put("severity", severity);
        details.put("level", level.name());
        details.put("reason", why);
        details.put("contacted", contacted);
        details.put("unreached", event.unreachedCount());
        details.put("elapsed_ms", elapsedMs);
        auditLogger.log(AuditLogger.AuditEvent.forSession(
                "escalation.trigger",
                "system",
                session.id(),
                event.unreachedCount() == 0 ? "ok" : "partial",
                notice.traceId(),
                details
        ));
        return event;
    }

    private ChannelCall start(EmergencyChannel channel, EscalationNotice notice) {
        ChannelCall call = new ChannelCall(channel, breakers.get("notify:" + channel.id()));
        try {
            call.result = CompletableFuture.supplyAsync(() -> notifyChannel(call, notice), fanout);
        } catch (RejectedExecutionException e) {
            call.result = CompletableFuture.completedFuture(ChannelOutcome.unreached(channel, 0L, "fan-out rejected: " + e.getMessage()));
        }
        return call;
    }

    private ChannelOutcome notifyChannel(ChannelCall call, EscalationNotice notice) {
        long t0 = System.nanoTime();
        EmergencyChannel channel = call.channel;
        if (!call.breaker.tryAcquire()) {
            call.settled.set(true);
            return ChannelOutcome.unreached(channel, 0L, CrisisLinkException.serviceUnavailable(call.breaker.name()).getMessage());
        }
        NotificationResult result;
        try {
            result = gateway.notify(channel, notice);
            if (result == null || !result.reached()) {
                throw new IllegalStateException(result == null ? "no result" : result.detail());
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (call.settle()) {
                call.breaker.recordFailure();
            }
            return ChannelOutcome.unreached(channel, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0), rootMessage(e));
        }
        if (call.settle()) {
            call.breaker.recordSuccess();
        } else {
            logger.debug("Channel {} answered after the deadline: {}", channel.id(), result.detail());
        }
        return ChannelOutcome.reached(channel, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
    }

    private ChannelOutcome await(ChannelCall call, long startNanos, long deadlineNanos) {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return call.result.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (call.settle()) {
                call.breaker.recordFailure();
            }
            call.result.cancel(true);
            return ChannelOutcome.unreached(
                    call.channel,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos),
                    "no answer within " + settings.notifyDeadlineMs() + "ms"
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ChannelOutcome.unreached(call.channel, 0L, "interrupted");
        } catch (ExecutionException e) {
            return ChannelOutcome.unreached(call.channel, 0L, rootMessage(e));
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return message == null ? current.getClass().getSimpleName() : message;
    }

    /** One notification attempt. Its breaker outcome is recorded once, by whichever of answer or deadline comes first. */
    private static final class ChannelCall {
        private final EmergencyChannel channel;
        private final CircuitBreaker breaker;
        private final AtomicBoolean settled = new AtomicBoolean();
        private volatile CompletableFuture<ChannelOutcome> result;

        private ChannelCall(EmergencyChannel channel, CircuitBreaker breaker) {
            this.channel = channel;
            this.breaker = breaker;
        }

        private boolean settle() {
            return settled.compareAndSet(false, true);
        }
    }
}
