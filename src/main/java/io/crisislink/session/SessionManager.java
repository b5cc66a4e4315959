package io.crisislink.session;

import io.crisislink.config.CrisisLinkSettings;
import io.crisislink.error.CrisisLinkException;
import io.crisislink.event.EventBus;
import io.crisislink.event.SessionEvent;
import io.crisislink.model.ConnectionId;
import io.crisislink.model.Feedback;
import io.crisislink.model.Role;
import io.crisislink.model.SessionId;
import io.crisislink.model.SessionRequest;
import io.crisislink.model.SessionStatus;
import io.crisislink.model.VolunteerProfile;
import io.crisislink.model.VolunteerRequest;
import io.crisislink.registry.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.LongSupplier;

public final class SessionManager {
    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);
    static final long ENDED_RETENTION_MS = 5L * 60L * 1000L;

    private final CrisisLinkSettings settings;
    private final VolunteerMatcher matcher;
    private final EventBus events;
    private final ScheduledExecutorService scheduler;
    private final LongSupplier clock;
    private final Map<SessionId, CrisisSession> sessions = new ConcurrentHashMap<>();
    private final Map<ConnectionId, SessionId> openByPerson = new HashMap<>();
    private volatile BiConsumer<SessionId, String> expiryHandler = (id, reason) -> {
    };

    public SessionManager(
            CrisisLinkSettings settings,
            VolunteerMatcher matcher,
            EventBus events,
            ScheduledExecutorService scheduler,
            LongSupplier clock
    ) {
        this.settings = settings;
        this.matcher = matcher;
        this.events = events;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /** Called with the session id and reason when a session timer expires. */
    public void onExpiry(BiConsumer<SessionId, String> handler) {
        this.expiryHandler = handler;
    }

    public CrisisSession start(Connection person, SessionRequest request) {
        if (person.role() != Role.PERSON_IN_CRISIS) {
            throw CrisisLinkException.invalidRequest("only a person in crisis can start a session, got " + person.role());
        }
        CrisisSession session;
        synchronized (openByPerson) {
            SessionId existing = openByPerson.get(person.id());
            if (existing != null) {
                CrisisSession current = sessions.get(existing);
                if (current != null && current.isOpen()) {
                    throw CrisisLinkException.alreadyConnected(person.participantId());
                }
            }
            session = new CrisisSession(
                    SessionId.random(),
                    person.id(),
                    request.severity(),
                    request.emergency(),
                    request.anonymous(),
                    clock.getAsLong()
            );
            sessions.put(session.id(), session);
            openByPerson.put(person.id(), session.id());
        }
        VolunteerRequest wanted = new VolunteerRequest(person.info().language(), null);
        Optional<ConnectionId> volunteer = matcher.claim(wanted);
        volunteer.ifPresent(session::attachVolunteer);
        armTimers(session);
        events.publish(new SessionEvent.SessionStarted(
                now(),
                session.id(),
                person.id(),
                session.status(),
                session.severity()
        ));
        if (volunteer.isPresent()) {
            events.publish(new SessionEvent.SessionMatched(now(), session.id(), volunteer.get()));
        } else {
            matcher.enqueue(session.id(), wanted, request.emergency() || request.severity() >= settings.escalationSeverityThreshold());
            publishQueuePositions();
        }
        logger.info("Session {} started for {} status={} severity={}", session.id(), person.id(), session.status(), session.severity());
        return session;
    }

    public CrisisSession require(SessionId sessionId) {
        CrisisSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw CrisisLinkException.sessionNotFound(sessionId);
        }
        return session;
    }

    public Optional<CrisisSession> find(SessionId sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<CrisisSession> openSessionFor(ConnectionId person) {
        SessionId id;
        synchronized (openByPerson) {
            id = openByPerson.get(person);
        }
        return Optional.ofNullable(id == null ? null : sessions.get(id)).filter(CrisisSession::isOpen);
    }

    /** Non-ended sessions that involve the connection as person or volunteer. */
    public List<CrisisSession> sessionsInvolving(ConnectionId connectionId) {
        List<CrisisSession> out = new ArrayList<>();
        for (CrisisSession session : sessions.values()) {
            if (session.status() == SessionStatus.ENDED) {
                continue;
            }
            if (session.personConnection().equals(connectionId)
                    || session.volunteerConnection().map(connectionId::equals).orElse(false)) {
                out.add(session);
            }
        }
        return out;
    }

    public void matchVolunteer(SessionId sessionId, ConnectionId volunteer) {
        CrisisSession session = require(sessionId);
        session.attachVolunteer(volunteer);
        matcher.claimSpecific(volunteer);
        matcher.dequeue(sessionId);
        events.publish(new SessionEvent.SessionMatched(now(), sessionId, volunteer));
        publishQueuePositions();
    }

    /**
     * Matches the session with a fitting volunteer when one is free, otherwise places it
     * in the wait queue. Returns the queue position, or 0 when matched.
     */
    public int requestVolunteer(SessionId sessionId, VolunteerRequest request) {
        CrisisSession session = require(sessionId);
        if (session.volunteerConnection().isPresent()) {
            return 0;
        }
        if (!session.isOpen()) {
            throw CrisisLinkException.invalidState("cannot request volunteer for " + session.status() + " session " + sessionId);
        }
        Optional<ConnectionId> volunteer = matcher.claim(request);
        if (volunteer.isPresent()) {
            session.attachVolunteer(volunteer.get());
            matcher.dequeue(sessionId);
            events.publish(new SessionEvent.SessionMatched(now(), sessionId, volunteer.get()));
            publishQueuePositions();
            return 0;
        }
        int position = matcher.enqueue(sessionId, request, session.emergency() || session.status() == SessionStatus.ESCALATED);
        publishQueuePositions();
        return position;
    }

    public void registerVolunteer(Connection volunteer, VolunteerProfile profile) {
        if (volunteer.role() == Role.PERSON_IN_CRISIS) {
            throw CrisisLinkException.invalidRequest("connection " + volunteer.id() + " is not a volunteer");
        }
        matcher.register(volunteer.id(), profile);
        logger.info("Volunteer {} available languages={} specializations={}",
                volunteer.id(), profile.languages(), profile.specializations());
        assignWaiting();
    }

    public void unregisterVolunteer(ConnectionId volunteer) {
        matcher.unregister(volunteer);
    }

    /**
     * Removes a departed volunteer from every open session it served and puts those
     * sessions back in the wait queue. Returns the affected session ids.
     */
    public List<SessionId> volunteerDisconnected(ConnectionId volunteer) {
        matcher.unregister(volunteer);
        List<SessionId> affected = new ArrayList<>();
        for (CrisisSession session : sessionsInvolving(volunteer)) {
            if (!session.isOpen() || session.personConnection().equals(volunteer)) {
                continue;
            }
            session.detachVolunteer(volunteer);
            matcher.enqueue(
                    session.id(),
                    VolunteerRequest.any(),
                    session.emergency() || session.status() == SessionStatus.ESCALATED
            );
            affected.add(session.id());
        }
        if (!affected.isEmpty()) {
            logger.info("Volunteer {} left, requeued sessions {}", volunteer, affected);
            assignWaiting();
        }
        return affected;
    }

    public void resolve(SessionId sessionId) {
        CrisisSession session = require(sessionId);
        session.resolve();
        release(session);
        logger.info("Session {} resolved", sessionId);
    }

    /** Counts a high-risk flag; returns the running total for the session. */
    public int flagRisk(SessionId sessionId) {
        return require(sessionId).flagRisk();
    }

    /**
     * Transitions the session to ENDED. Returns the session when this call ended it, or
     * empty when it had already ended.
     */
    public Optional<CrisisSession> end(SessionId sessionId, String reason, Feedback feedback) {
        CrisisSession session = require(sessionId);
        if (!session.end(reason, feedback, clock.getAsLong())) {
            return Optional.empty();
        }
        release(session);
        scheduleRemoval(sessionId);
        logger.info("Session {} ended reason={}", sessionId, reason);
        return Optional.of(session);
    }

    public Map<SessionStatus, Integer> countByStatus() {
        Map<SessionStatus, Integer> out = new EnumMap<>(SessionStatus.class);
        for (SessionStatus status : SessionStatus.values()) {
            out.put(status, 0);
        }
        for (CrisisSession session : sessions.values()) {
            out.merge(session.status(), 1, Integer::sum);
        }
        return out;
    }

    public int openCount() {
        return (int) sessions.values().stream().filter(CrisisSession::isOpen).count();
    }

    public VolunteerMatcher matcher() {
        return matcher;
    }

    private void release(CrisisSession session) {
        synchronized (openByPerson) {
            openByPerson.remove(session.personConnection(), session.id());
        }
        matcher.dequeue(session.id());
        session.volunteerConnection().ifPresent(matcher::release);
        publishQueuePositions();
        assignWaiting();
    }

    private void assignWaiting() {
        for (VolunteerMatcher.Assignment assignment : matcher.assignWaiting()) {
            CrisisSession waiting = sessions.get(assignment.sessionId());
            if (waiting == null || !waiting.isOpen()) {
                matcher.release(assignment.volunteer());
                continue;
            }
            waiting.attachVolunteer(assignment.volunteer());
            events.publish(new SessionEvent.SessionMatched(now(), assignment.sessionId(), assignment.volunteer()));
        }
        publishQueuePositions();
    }

    private void publishQueuePositions() {
        matcher.positions().forEach((sessionId, position) ->
                events.publish(new SessionEvent.QueueUpdate(now(), sessionId, position)));
    }

    private void armTimers(CrisisSession session) {
        try {
            session.bindTimer(scheduler.schedule(
                    () -> expiryHandler.accept(session.id(), "max_duration"),
                    settings.maxSessionDurationMs(),
                    TimeUnit.MILLISECONDS
            ));
            scheduleInactivityCheck(session, settings.inactivityTimeoutMs());
        } catch (RejectedExecutionException e) {
            logger.warn("Scheduler rejected timers for session {}", session.id());
        }
    }

    private void scheduleInactivityCheck(CrisisSession session, long delayMs) {
        session.bindTimer(scheduler.schedule(() -> checkInactivity(session), delayMs, TimeUnit.MILLISECONDS));
    }

    private void checkInactivity(CrisisSession session) {
        if (!session.isOpen()) {
            return;
        }
        long timeout = settings.inactivityTimeoutMs();
        if (session.status() == SessionStatus.ESCALATED) {
            scheduleInactivityCheck(session, timeout);
            return;
        }
        long idle = clock.getAsLong() - session.lastActivityMs();
        if (idle >= timeout) {
            expiryHandler.accept(session.id(), "inactivity");
        } else {
            scheduleInactivityCheck(session, timeout - idle);
        }
    }

    private void scheduleRemoval(SessionId sessionId) {
        try {
            scheduler.schedule(() -> sessions.remove(sessionId), ENDED_RETENTION_MS, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            sessions.remove(sessionId);
        }
    }

    private Instant now() {
        return Instant.ofEpochMilli(clock.getAsLong());
    }
}
