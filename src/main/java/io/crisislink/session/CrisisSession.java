package io.crisislink.session;

import io.crisislink.error.CrisisLinkException;
import io.crisislink.model.ConnectionId;
import io.crisislink.model.CrisisMessage;
import io.crisislink.model.Feedback;
import io.crisislink.model.MessageId;
import io.crisislink.model.MessageKind;
import io.crisislink.model.MessagePriority;
import io.crisislink.model.Role;
import io.crisislink.model.SessionId;
import io.crisislink.model.SessionStatus;
import io.crisislink.model.SessionSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * One conversation between a person in crisis and, once matched, a volunteer.
 * <p>
 * Lifecycle: {@code WAITING -> ACTIVE -> ESCALATED -> RESOLVED}, and {@code ENDED}
 * from any state. Severity only rises. All mutators synchronize on the session
 * instance, which callers may also hold to make a sequence of operations atomic.
 */
public final class CrisisSession {
    private final SessionId id;
    private final ConnectionId personConnection;
    private final boolean anonymous;
    private final Instant startedAt;
    private final List<CrisisMessage> history = new ArrayList<>();
    private final List<Instant> escalatedAt = new ArrayList<>();
    private final List<ScheduledFuture<?>> timers = new ArrayList<>();

    private SessionStatus status;
    private int severity;
    private boolean emergency;
    private ConnectionId volunteerConnection;
    private long nextSequence = 1L;
    private long lastActivityMs;
    private int riskFlags;
    private Instant endedAt;
    private String endReason;
    private Feedback feedback;

    public CrisisSession(SessionId id, ConnectionId personConnection, int severity, boolean emergency, boolean anonymous, long nowMs) {
        this.id = id;
        this.personConnection = personConnection;
        this.severity = Math.max(1, Math.min(10, severity));
        this.emergency = emergency;
        this.anonymous = anonymous;
        this.startedAt = Instant.ofEpochMilli(nowMs);
        this.lastActivityMs = nowMs;
        this.status = SessionStatus.WAITING;
    }

    public SessionId id() {
        return id;
    }

    public ConnectionId personConnection() {
        return personConnection;
    }

    public boolean anonymous() {
        return anonymous;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized SessionStatus status() {
        return status;
    }

    public synchronized int severity() {
        return severity;
    }

    public synchronized boolean emergency() {
        return emergency;
    }

    public synchronized Optional<ConnectionId> volunteerConnection() {
        return Optional.ofNullable(volunteerConnection);
    }

    public synchronized long lastActivityMs() {
        return lastActivityMs;
    }

    public synchronized int escalationCount() {
        return escalatedAt.size();
    }

    public synchronized List<Instant> escalatedAt() {
        return List.copyOf(escalatedAt);
    }

    public synchronized List<CrisisMessage> history() {
        return List.copyOf(history);
    }

    public synchronized int riskFlags() {
        return riskFlags;
    }

    public synchronized boolean isOpen() {
        return !status.isTerminal();
    }

    synchronized void attachVolunteer(ConnectionId volunteer) {
        if (status.isTerminal()) {
            throw CrisisLinkException.invalidState("cannot match volunteer on " + status + " session " + id);
        }
        if (volunteerConnection != null && !volunteerConnection.equals(volunteer)) {
            throw CrisisLinkException.invalidState("session " + id + " already matched with " + volunteerConnection);
        }
        volunteerConnection = volunteer;
        if (status == SessionStatus.WAITING) {
            status = SessionStatus.ACTIVE;
        }
    }

    synchronized void detachVolunteer(ConnectionId volunteer) {
        if (volunteer.equals(volunteerConnection)) {
            volunteerConnection = null;
        }
    }

    /**
     * Moves the session to ESCALATED and raises severity. Returns {@code false} without
     * changing anything when the session is already escalated at this severity or above.
     */
    public synchronized boolean escalate(int requestedSeverity, long nowMs) {
        if (status.isTerminal()) {
            throw CrisisLinkException.invalidState("cannot escalate " + status + " session " + id);
        }
        int target = Math.max(1, Math.min(10, requestedSeverity));
        if (status == SessionStatus.ESCALATED && target <= severity) {
            return false;
        }
        severity = Math.max(severity, target);
        status = SessionStatus.ESCALATED;
        escalatedAt.add(Instant.ofEpochMilli(nowMs));
        lastActivityMs = nowMs;
        return true;
    }

    public synchronized void markEmergency() {
        emergency = true;
    }

    synchronized int flagRisk() {
        return ++riskFlags;
    }

    synchronized void resolve() {
        if (status != SessionStatus.ACTIVE && status != SessionStatus.ESCALATED) {
            throw CrisisLinkException.invalidState("cannot resolve " + status + " session " + id);
        }
        status = SessionStatus.RESOLVED;
    }

    synchronized boolean end(String reason, Feedback sessionFeedback, long nowMs) {
        if (status == SessionStatus.ENDED) {
            return false;
        }
        status = SessionStatus.ENDED;
        endReason = reason;
        feedback = sessionFeedback == null ? Feedback.none() : sessionFeedback;
        endedAt = Instant.ofEpochMilli(nowMs);
        cancelTimers();
        return true;
    }

    /**
     * Creates the next message of this session. Chat and system messages join the
     * history; typing and presence signals only receive a sequence number.
     */
    public synchronized CrisisMessage newMessage(
            Role sender,
            MessageKind kind,
            MessagePriority priority,
            String payload,
            boolean encrypted,
            boolean compressed,
            long nowMs
    ) {
        if (status == SessionStatus.ENDED) {
            throw CrisisLinkException.invalidState("session " + id + " has ended");
        }
        CrisisMessage message = new CrisisMessage(
                MessageId.random(),
                id,
                nextSequence++,
                sender,
                kind,
                priority,
                payload,
                encrypted,
                compressed,
                Instant.ofEpochMilli(nowMs)
        );
        if (!kind.isBestEffort()) {
            history.add(message);
            lastActivityMs = nowMs;
        }
        return message;
    }

    public synchronized void touch(long nowMs) {
        lastActivityMs = Math.max(lastActivityMs, nowMs);
    }

    synchronized void bindTimer(ScheduledFuture<?> timer) {
        if (status == SessionStatus.ENDED) {
            timer.cancel(false);
            return;
        }
        timers.removeIf(ScheduledFuture::isDone);
        timers.add(timer);
    }

    private void cancelTimers() {
        for (ScheduledFuture<?> timer : timers) {
            timer.cancel(false);
        }
        timers.clear();
    }

    synchronized int activeTimers() {
        timers.removeIf(ScheduledFuture::isDone);
        return timers.size();
    }

    public synchronized SessionSummary summary() {
        Instant end = endedAt == null ? Instant.now() : endedAt;
        Feedback fb = feedback == null ? Feedback.none() : feedback;
        return new SessionSummary(
                id,
                status,
                severity,
                emergency,
                anonymous,
                history.size(),
                escalatedAt.size(),
                endReason,
                fb.rating(),
                fb.comment(),
                startedAt,
                endedAt,
                Math.max(0L, end.toEpochMilli() - startedAt.toEpochMilli())
        );
    }
}
