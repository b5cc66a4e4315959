package io.crisislink.session;

import io.crisislink.config.CrisisLinkSettings;
import io.crisislink.error.CrisisLinkException;
import io.crisislink.error.ErrorKind;
import io.crisislink.event.EventBus;
import io.crisislink.event.SessionEvent;
import io.crisislink.model.ConnectionId;
import io.crisislink.model.ConnectionInfo;
import io.crisislink.model.Feedback;
import io.crisislink.model.SessionId;
import io.crisislink.model.SessionRequest;
import io.crisislink.model.SessionStatus;
import io.crisislink.model.VolunteerProfile;
import io.crisislink.registry.Connection;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;

final class SessionManagerTest {

    @Test
    void sessionWaitsUntilAVolunteerRegisters() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            List<SessionEvent> events = new CopyOnWriteArrayList<>();
            SessionManager manager = manager(CrisisLinkSettings.defaults(), scheduler, events);

            CrisisSession session = manager.start(person("anon-1"), SessionRequest.of(4));
            Assertions.assertEquals(SessionStatus.WAITING, session.status());
            Assertions.assertEquals(1, manager.matcher().waitingCount());

            Connection volunteer = volunteer("vol-1");
            manager.registerVolunteer(volunteer, VolunteerProfile.general());

            Assertions.assertEquals(SessionStatus.ACTIVE, session.status());
            Assertions.assertEquals(volunteer.id(), session.volunteerConnection().orElseThrow());
            Assertions.assertEquals(0, manager.matcher().waitingCount());
            Assertions.assertTrue(events.stream().anyMatch(e -> e instanceof SessionEvent.SessionStarted));
            Assertions.assertTrue(events.stream().anyMatch(e -> e instanceof SessionEvent.QueueUpdate));
            Assertions.assertTrue(events.stream().anyMatch(e -> e instanceof SessionEvent.SessionMatched));
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void personMayHoldOnlyOneOpenSession() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            SessionManager manager = manager(CrisisLinkSettings.defaults(), scheduler, new CopyOnWriteArrayList<>());
            Connection person = person("anon-2");
            CrisisSession first = manager.start(person, SessionRequest.of(3));

            CrisisLinkException duplicate = Assertions.assertThrows(
                    CrisisLinkException.class,
                    () -> manager.start(person, SessionRequest.of(3))
            );
            Assertions.assertEquals(ErrorKind.ALREADY_CONNECTED, duplicate.kind());

            Assertions.assertTrue(manager.end(first.id(), "completed", Feedback.none()).isPresent());
            Assertions.assertTrue(manager.end(first.id(), "completed", Feedback.none()).isEmpty());
            Assertions.assertEquals(0, first.activeTimers());
            Assertions.assertNotEquals(first.id(), manager.start(person, SessionRequest.of(3)).id());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void onlyPeopleInCrisisStartSessions() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            SessionManager manager = manager(CrisisLinkSettings.defaults(), scheduler, new CopyOnWriteArrayList<>());
            CrisisLinkException error = Assertions.assertThrows(
                    CrisisLinkException.class,
                    () -> manager.start(volunteer("vol-x"), SessionRequest.of(3))
            );
            Assertions.assertEquals(ErrorKind.INVALID_REQUEST, error.kind());
            Assertions.assertThrows(CrisisLinkException.class, () -> manager.require(SessionId.random()));
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void departedVolunteerSessionsAreRequeuedToAnotherVolunteer() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            SessionManager manager = manager(CrisisLinkSettings.defaults(), scheduler, new CopyOnWriteArrayList<>());
            Connection first = volunteer("vol-a");
            manager.registerVolunteer(first, VolunteerProfile.general());
            CrisisSession session = manager.start(person("anon-3"), SessionRequest.of(5));
            Assertions.assertEquals(first.id(), session.volunteerConnection().orElseThrow());

            Connection second = volunteer("vol-b");
            manager.registerVolunteer(second, VolunteerProfile.general());
            List<SessionId> affected = manager.volunteerDisconnected(first.id());

            Assertions.assertEquals(List.of(session.id()), affected);
            Assertions.assertEquals(second.id(), session.volunteerConnection().orElseThrow());
            Assertions.assertFalse(manager.matcher().isRegistered(first.id()));
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void maxDurationTimerReportsExpiry() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            CrisisLinkSettings settings = CrisisLinkSettings.parse("""
                    { "maxSessionDurationMs": 1000 }
                    """);
            SessionManager manager = manager(settings, scheduler, new CopyOnWriteArrayList<>());
            List<String> expired = new CopyOnWriteArrayList<>();
            manager.onExpiry((id, reason) -> expired.add(id + ":" + reason));

            CrisisSession session = manager.start(person("anon-4"), SessionRequest.of(2));

            await().atMost(5, TimeUnit.SECONDS).until(() -> !expired.isEmpty());
            Assertions.assertEquals(session.id() + ":max_duration", expired.get(0));
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void resolveRequiresAnActiveSession() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            SessionManager manager = manager(CrisisLinkSettings.defaults(), scheduler, new CopyOnWriteArrayList<>());
            manager.registerVolunteer(volunteer("vol-r"), VolunteerProfile.general());
            CrisisSession session = manager.start(person("anon-5"), SessionRequest.of(3));

            manager.resolve(session.id());
            Assertions.assertEquals(SessionStatus.RESOLVED, session.status());
            Assertions.assertEquals(1, manager.matcher().availableVolunteers());
            Assertions.assertTrue(manager.openSessionFor(session.personConnection()).isEmpty());
        } finally {
            scheduler.shutdownNow();
        }
    }

    private static SessionManager manager(
            CrisisLinkSettings settings,
            ScheduledExecutorService scheduler,
            List<SessionEvent> sink
    ) {
        EventBus bus = new EventBus(Runnable::run);
        bus.subscribe(sink::add);
        return new SessionManager(
                settings,
                new VolunteerMatcher(settings.volunteerCapacity()),
                bus,
                scheduler,
                System::currentTimeMillis
        );
    }

    private static Connection person(String participant) {
        return new Connection(ConnectionId.random(), ConnectionInfo.anonymousPerson(participant), Instant.now(), 0L, null);
    }

    private static Connection volunteer(String participant) {
        return new Connection(ConnectionId.random(), ConnectionInfo.volunteer(participant, "en"), Instant.now(), 0L, null);
    }
}
