package io.crisislink.delivery;

import io.crisislink.config.CrisisLinkSettings;
import io.crisislink.error.CrisisLinkException;
import io.crisislink.error.ErrorKind;
import io.crisislink.event.EventBus;
import io.crisislink.event.SessionEvent;
import io.crisislink.failover.LoadMonitor;
import io.crisislink.model.ConnectionId;
import io.crisislink.model.ConnectionInfo;
import io.crisislink.model.CrisisMessage;
import io.crisislink.model.DeliveryOptions;
import io.crisislink.model.DeliveryReceipt;
import io.crisislink.model.DeliveryStatus;
import io.crisislink.model.MessageKind;
import io.crisislink.model.MessagePriority;
import io.crisislink.model.Role;
import io.crisislink.model.SessionRequest;
import io.crisislink.registry.Connection;
import io.crisislink.registry.ConnectionRegistry;
import io.crisislink.resilience.RateLimiter;
import io.crisislink.session.CrisisSession;
import io.crisislink.session.SessionManager;
import io.crisislink.session.VolunteerMatcher;
import io.crisislink.storage.AsyncPersistence;
import io.crisislink.storage.InMemorySessionStore;
import io.crisislink.storage.StoredMessage;
import io.crisislink.transport.LoopbackTransport;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;

final class DeliveryPipelineTest {
    private static final String FAST_SETTINGS = """
            {
              "messageQueueSize": 1000,
              "rateLimit": {
                "maxMessagesPerSecond": 100000,
                "maxMessagesPerMinute": 1000000,
                "maxBytesPerSecond": 100000000
              }
            }
            """;

    @Test
    void messagesArriveInSequenceOrderOnTheOtherSide() {
        try (Fixture f = new Fixture(FAST_SETTINGS, true)) {
            List<CompletableFuture<DeliveryReceipt>> receipts = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                boolean fromPerson = i % 2 == 0;
                receipts.add(f.pipeline.submit(
                        f.session,
                        fromPerson ? f.person.id() : f.volunteer.id(),
                        fromPerson ? Role.PERSON_IN_CRISIS : Role.VOLUNTEER,
                        MessageKind.CHAT,
                        "message " + i,
                        DeliveryOptions.standard()
                ));
            }
            for (CompletableFuture<DeliveryReceipt> receipt : receipts) {
                Assertions.assertEquals(DeliveryStatus.ACKNOWLEDGED, receipt.join().status());
            }

            List<CrisisMessage> toVolunteer = f.volunteerTransport.delivered();
            List<CrisisMessage> toPerson = f.personTransport.delivered();
            Assertions.assertEquals(25, toVolunteer.size());
            Assertions.assertEquals(25, toPerson.size());
            for (int i = 0; i < 25; i++) {
                Assertions.assertEquals(2L * i + 1L, toVolunteer.get(i).sequence());
                Assertions.assertEquals("message " + (2 * i), toVolunteer.get(i).payload());
                Assertions.assertEquals(Role.PERSON_IN_CRISIS, toVolunteer.get(i).senderRole());
                Assertions.assertEquals(2L * i + 2L, toPerson.get(i).sequence());
                Assertions.assertEquals("message " + (2 * i + 1), toPerson.get(i).payload());
            }
            await().atMost(5, TimeUnit.SECONDS).until(() -> f.events.stream()
                    .filter(e -> e instanceof SessionEvent.MessageReceived).count() == 50);
        }
    }

    @Test
    void personMessagesGoOverTheVolunteerLinkOnly() {
        try (Fixture f = new Fixture(FAST_SETTINGS, true)) {
            for (int i = 0; i < 5; i++) {
                DeliveryReceipt receipt = f.pipeline.send(f.session, f.person.id(), Role.PERSON_IN_CRISIS, MessageKind.CHAT, "help " + i, DeliveryOptions.standard());
                Assertions.assertEquals(DeliveryStatus.ACKNOWLEDGED, receipt.status());
            }

            Assertions.assertEquals(0, f.personTransport.sendAttempts());
            List<CrisisMessage> received = f.volunteerTransport.delivered();
            Assertions.assertEquals(5, received.size());
            for (int i = 0; i < 5; i++) {
                Assertions.assertEquals("help " + i, received.get(i).payload());
            }
        }
    }

    @Test
    void transientFailuresAreRetriedWithinTheBudget() {
        try (Fixture f = new Fixture(FAST_SETTINGS, true)) {
            f.personTransport.failNextSends(2);
            DeliveryReceipt receipt = f.pipeline.send(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "still here", DeliveryOptions.standard());

            Assertions.assertEquals(DeliveryStatus.ACKNOWLEDGED, receipt.status());
            Assertions.assertEquals(3, receipt.attempts());
            Assertions.assertEquals(3, f.personTransport.sendAttempts());
        }
    }

    @Test
    void exhaustedRetriesFailTheMessage() {
        try (Fixture f = new Fixture(FAST_SETTINGS, true)) {
            f.personTransport.failNextSends(100);
            CrisisLinkException failure = Assertions.assertThrows(
                    CrisisLinkException.class,
                    () -> f.pipeline.send(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "lost", DeliveryOptions.standard())
            );

            Assertions.assertEquals(ErrorKind.DELIVERY_FAILED, failure.kind());
            Assertions.assertEquals(3, f.personTransport.sendAttempts());
            Assertions.assertEquals(1L, f.pipeline.stats().failed());
            Assertions.assertEquals(0, f.pipeline.pending(f.session.id()));

            Assertions.assertTrue(f.persistence.flush(5_000L));
            List<StoredMessage> stored = f.store.loadSessionHistory(f.session.id());
            Assertions.assertEquals(DeliveryStatus.FAILED, stored.get(0).status());
        }
    }

    @Test
    void droppedVolunteerLinkHoldsPersonMessagesAndReplaysThemInOrder() {
        try (Fixture f = new Fixture(FAST_SETTINGS, true)) {
            AtomicReference<ConnectionId> lost = new AtomicReference<>();
            f.pipeline.onLinkLost(lost::set);
            f.volunteerTransport.dropLink();

            List<DeliveryReceipt> queued = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                queued.add(f.pipeline.send(f.session, f.person.id(), Role.PERSON_IN_CRISIS, MessageKind.CHAT, "offline " + i, DeliveryOptions.standard()));
            }
            for (DeliveryReceipt receipt : queued) {
                Assertions.assertEquals(DeliveryStatus.QUEUED, receipt.status());
            }
            Assertions.assertEquals(f.volunteer.id(), lost.get());
            Assertions.assertTrue(f.pipeline.isOffline(f.session.id()));
            Assertions.assertEquals(5, f.pipeline.pending(f.session.id()));

            DeliveryReceipt reply = f.pipeline.send(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "I'm here", DeliveryOptions.standard());
            Assertions.assertEquals(DeliveryStatus.ACKNOWLEDGED, reply.status());
            Assertions.assertEquals(1, f.personTransport.delivered().size());

            DeliveryReceipt typing = f.pipeline.send(f.session, f.person.id(), Role.PERSON_IN_CRISIS, MessageKind.TYPING, "true", DeliveryOptions.withPriority(MessagePriority.LOW));
            Assertions.assertEquals(DeliveryStatus.FAILED, typing.status());

            LoopbackTransport replacement = new LoopbackTransport("secondary", f.volunteer.info());
            f.registry.rebind(f.volunteer.id(), replacement);
            f.pipeline.resumeLink(f.volunteer.id());

            await().atMost(5, TimeUnit.SECONDS).until(() -> replacement.delivered().size() == 5);
            List<CrisisMessage> replayed = replacement.delivered();
            for (int i = 0; i < 5; i++) {
                Assertions.assertEquals("offline " + i, replayed.get(i).payload());
            }
            await().atMost(5, TimeUnit.SECONDS).until(() -> f.pipeline.pending(f.session.id()) == 0);
            Assertions.assertFalse(f.pipeline.isOffline(f.session.id()));
            Assertions.assertEquals(5L, f.pipeline.stats().queuedOffline());
            Assertions.assertEquals(1L, f.pipeline.stats().droppedBestEffort());
        }
    }

    @Test
    void personMessagesWaitUntilAVolunteerIsMatched() {
        try (Fixture f = new Fixture(FAST_SETTINGS, false)) {
            AtomicReference<ConnectionId> lost = new AtomicReference<>();
            f.pipeline.onLinkLost(lost::set);

            DeliveryReceipt first = f.pipeline.send(f.session, f.person.id(), Role.PERSON_IN_CRISIS, MessageKind.CHAT, "is anyone there", DeliveryOptions.standard());
            DeliveryReceipt second = f.pipeline.send(f.session, f.person.id(), Role.PERSON_IN_CRISIS, MessageKind.CHAT, "please", DeliveryOptions.standard());
            Assertions.assertEquals(DeliveryStatus.QUEUED, first.status());
            Assertions.assertEquals(DeliveryStatus.QUEUED, second.status());
            Assertions.assertNull(lost.get());

            f.sessions.matchVolunteer(f.session.id(), f.volunteer.id());
            f.pipeline.recipientsChanged(f.session.id());

            await().atMost(5, TimeUnit.SECONDS).until(() -> f.volunteerTransport.delivered().size() == 2);
            Assertions.assertEquals("is anyone there", f.volunteerTransport.delivered().get(0).payload());
            Assertions.assertEquals("please", f.volunteerTransport.delivered().get(1).payload());
            Assertions.assertEquals(0, f.personTransport.sendAttempts());
            await().atMost(5, TimeUnit.SECONDS).until(() -> !f.pipeline.isOffline(f.session.id()));
        }
    }

    @Test
    void abandonedLinkFailsTheMessagesHeldForIt() {
        try (Fixture f = new Fixture(FAST_SETTINGS, true)) {
            f.volunteerTransport.dropLink();
            DeliveryReceipt one = f.pipeline.send(f.session, f.person.id(), Role.PERSON_IN_CRISIS, MessageKind.CHAT, "one", DeliveryOptions.standard());
            DeliveryReceipt two = f.pipeline.send(f.session, f.person.id(), Role.PERSON_IN_CRISIS, MessageKind.CHAT, "two", DeliveryOptions.standard());
            Assertions.assertEquals(DeliveryStatus.QUEUED, one.status());
            Assertions.assertEquals(DeliveryStatus.QUEUED, two.status());

            f.pipeline.abandonLink(f.volunteer.id(), "reconnect_exhausted");

            await().atMost(5, TimeUnit.SECONDS).until(() -> f.pipeline.stats().failed() == 2L);
            Assertions.assertEquals(0, f.pipeline.pending(f.session.id()));
            Assertions.assertTrue(f.persistence.flush(5_000L));
            for (StoredMessage stored : f.store.loadSessionHistory(f.session.id())) {
                Assertions.assertEquals(DeliveryStatus.FAILED, stored.status());
            }

            CrisisLinkException later = Assertions.assertThrows(
                    CrisisLinkException.class,
                    () -> f.pipeline.send(f.session, f.person.id(), Role.PERSON_IN_CRISIS, MessageKind.CHAT, "three", DeliveryOptions.standard())
            );
            Assertions.assertEquals(ErrorKind.DELIVERY_FAILED, later.kind());

            DeliveryReceipt reply = f.pipeline.send(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "still with you", DeliveryOptions.standard());
            Assertions.assertTrue(reply.delivered());
        }
    }

    @Test
    void fullOutboxRejectsAllButCriticalMessages() {
        try (Fixture f = new Fixture("""
                {
                  "messageQueueSize": 1,
                  "rateLimit": { "maxMessagesPerSecond": 1000, "maxMessagesPerMinute": 10000 }
                }
                """, true)) {
            f.personTransport.setAckDelayMs(300L);
            CompletableFuture<DeliveryReceipt> inFlight = f.pipeline.submit(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "first", DeliveryOptions.standard());

            CrisisLinkException full = Assertions.assertThrows(
                    CrisisLinkException.class,
                    () -> f.pipeline.submit(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "second", DeliveryOptions.standard())
            );
            Assertions.assertEquals(ErrorKind.RATE_LIMITED, full.kind());

            CompletableFuture<DeliveryReceipt> critical = f.pipeline.submit(
                    f.session, f.person.id(), Role.PERSON_IN_CRISIS, MessageKind.CHAT, "help", DeliveryOptions.emergencyMessage());
            Assertions.assertTrue(inFlight.join().delivered());
            Assertions.assertTrue(critical.join().delivered());
            Assertions.assertEquals(MessagePriority.EMERGENCY, f.volunteerTransport.delivered().get(0).priority());
        }
    }

    @Test
    void fullOutboxRejectionDoesNotSpendTheSendersRateBudget() {
        try (Fixture f = new Fixture("""
                {
                  "messageQueueSize": 1,
                  "rateLimit": { "maxMessagesPerSecond": 3, "maxMessagesPerMinute": 100 }
                }
                """, true)) {
            f.personTransport.setAckDelayMs(300L);
            CompletableFuture<DeliveryReceipt> inFlight = f.pipeline.submit(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "first", DeliveryOptions.standard());

            for (int i = 0; i < 5; i++) {
                int n = i;
                CrisisLinkException full = Assertions.assertThrows(
                        CrisisLinkException.class,
                        () -> f.pipeline.submit(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "extra " + n, DeliveryOptions.standard())
                );
                Assertions.assertTrue(full.getMessage().contains("queue full"), full.getMessage());
            }

            RateLimiter.Status status = f.rateLimiter.status(f.volunteer.id());
            Assertions.assertFalse(status.banned());
            Assertions.assertTrue(status.messagesThisSecond() <= 1, "counted " + status.messagesThisSecond());
            Assertions.assertEquals(0L, f.rateLimiter.rejectedTotal());
            Assertions.assertTrue(inFlight.join().delivered());
        }
    }

    @Test
    void twoHundredSequentialMessagesStayInsideTheLatencyBudget() {
        try (Fixture f = new Fixture(FAST_SETTINGS, true)) {
            for (int i = 0; i < 200; i++) {
                Assertions.assertTrue(f.pipeline.send(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "ping " + i, DeliveryOptions.standard()).delivered());
            }
            DeliveryStats stats = f.pipeline.stats();
            Assertions.assertEquals(200L, stats.delivered());
            Assertions.assertTrue(stats.latency().withinBudgetRatio() >= 0.98d,
                    "within budget ratio " + stats.latency().withinBudgetRatio());
        }
    }

    @Test
    void burstOfFiveHundredIsDelivered() {
        try (Fixture f = new Fixture(FAST_SETTINGS, true)) {
            List<CompletableFuture<DeliveryReceipt>> receipts = new ArrayList<>();
            for (int i = 0; i < 500; i++) {
                receipts.add(f.pipeline.submit(f.session, f.person.id(), Role.PERSON_IN_CRISIS, MessageKind.CHAT, "burst " + i, DeliveryOptions.standard()));
            }
            int delivered = 0;
            for (CompletableFuture<DeliveryReceipt> receipt : receipts) {
                if (receipt.join().delivered()) {
                    delivered++;
                }
            }
            Assertions.assertTrue(delivered >= 498, "delivered " + delivered);
            Assertions.assertEquals(500, f.volunteerTransport.delivered().size());
        }
    }

    @Test
    void closeDrainsPendingMessagesWhileTheLinkIsUp() throws Exception {
        try (Fixture f = new Fixture(FAST_SETTINGS, true)) {
            f.personTransport.setAckDelayMs(5L);
            f.volunteerTransport.setAckDelayMs(5L);
            List<CompletableFuture<DeliveryReceipt>> receipts = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                receipts.add(f.pipeline.submit(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "bye " + i, DeliveryOptions.standard()));
                receipts.add(f.pipeline.submit(f.session, f.person.id(), Role.PERSON_IN_CRISIS, MessageKind.CHAT, "thanks " + i, DeliveryOptions.standard()));
            }
            f.pipeline.close(f.session.id()).get(5, TimeUnit.SECONDS);

            for (CompletableFuture<DeliveryReceipt> receipt : receipts) {
                Assertions.assertTrue(receipt.join().delivered());
            }
            Assertions.assertEquals(0, f.pipeline.stats().activeOutboxes());
        }
    }

    @Test
    void closeWhileOfflineFailsWhatCouldNotBeDelivered() throws Exception {
        try (Fixture f = new Fixture(FAST_SETTINGS, true)) {
            f.personTransport.dropLink();
            f.pipeline.send(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "one", DeliveryOptions.standard());
            f.pipeline.send(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "two", DeliveryOptions.standard());

            f.pipeline.close(f.session.id()).get(5, TimeUnit.SECONDS);

            Assertions.assertEquals(2L, f.pipeline.stats().failed());
            Assertions.assertEquals(0L, f.pipeline.stats().pending());
        }
    }

    @Test
    void retryWaitingMessageIsFailedWhenTheSessionCloses() throws Exception {
        try (Fixture f = new Fixture("""
                {
                  "baseBackoffMs": 2000,
                  "maxBackoffMs": 2000,
                  "rateLimit": { "maxMessagesPerSecond": 1000, "maxMessagesPerMinute": 10000 }
                }
                """, true)) {
            f.personTransport.failNextSends(1);
            CompletableFuture<DeliveryReceipt> receipt = f.pipeline.submit(f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "wait", DeliveryOptions.standard());
            await().atMost(5, TimeUnit.SECONDS).until(() -> f.personTransport.sendAttempts() == 1);

            f.pipeline.close(f.session.id()).get(1, TimeUnit.SECONDS);

            CompletionException error = Assertions.assertThrows(CompletionException.class, receipt::join);
            Assertions.assertEquals(ErrorKind.DELIVERY_FAILED, ((CrisisLinkException) error.getCause()).kind());
        }
    }

    @Test
    void encryptedPayloadNeedsAKeyring() {
        try (Fixture f = new Fixture(FAST_SETTINGS, true)) {
            Assertions.assertThrows(IllegalStateException.class, () -> f.pipeline.submit(
                    f.session, f.volunteer.id(), Role.VOLUNTEER, MessageKind.CHAT, "secret", new DeliveryOptions(false, true, MessagePriority.NORMAL)));
        }
    }

    private static final class Fixture implements AutoCloseable {
        private final ExecutorService workers = Executors.newFixedThreadPool(4);
        private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        private final List<SessionEvent> events = new CopyOnWriteArrayList<>();
        private final InMemorySessionStore store = new InMemorySessionStore();
        private final AsyncPersistence persistence = new AsyncPersistence(store);
        private final ConnectionRegistry registry;
        private final RateLimiter rateLimiter;
        private final SessionManager sessions;
        private final DeliveryPipeline pipeline;
        private final LoopbackTransport personTransport;
        private final LoopbackTransport volunteerTransport;
        private final Connection person;
        private final Connection volunteer;
        private final CrisisSession session;

        private Fixture(String settingsJson, boolean matched) {
            CrisisLinkSettings settings = CrisisLinkSettings.parse(settingsJson);
            EventBus bus = new EventBus(workers);
            bus.subscribe(events::add);
            registry = new ConnectionRegistry(10, System::currentTimeMillis);
            ConnectionInfo personInfo = ConnectionInfo.anonymousPerson("anon-delivery");
            personTransport = new LoopbackTransport("primary", personInfo);
            person = registry.admit(personInfo, personTransport);
            ConnectionInfo volunteerInfo = ConnectionInfo.volunteer("vol-delivery", "en");
            volunteerTransport = new LoopbackTransport("primary", volunteerInfo);
            volunteer = registry.admit(volunteerInfo, volunteerTransport);
            sessions = new SessionManager(
                    settings,
                    new VolunteerMatcher(settings.volunteerCapacity()),
                    bus,
                    scheduler,
                    System::currentTimeMillis
            );
            session = sessions.start(person, SessionRequest.of(4));
            if (matched) {
                sessions.matchVolunteer(session.id(), volunteer.id());
            }
            rateLimiter = new RateLimiter(settings.rateLimit(), System::currentTimeMillis);
            pipeline = new DeliveryPipeline(
                    settings,
                    registry,
                    bus,
                    rateLimiter,
                    new PayloadCodec(null, false),
                    persistence,
                    new LoadMonitor(),
                    workers,
                    scheduler,
                    System::currentTimeMillis
            );
        }

        @Override
        public void close() {
            pipeline.close();
            persistence.close();
            scheduler.shutdownNow();
            workers.shutdownNow();
        }
    }
}
