package io.crisislink.delivery;

import io.crisislink.config.CrisisLinkSettings;
import io.crisislink.error.CrisisLinkException;
import io.crisislink.event.EventBus;
import io.crisislink.event.SessionEvent;
import io.crisislink.failover.LoadMonitor;
import io.crisislink.model.ConnectionId;
import io.crisislink.model.CrisisMessage;
import io.crisislink.model.DeliveryOptions;
import io.crisislink.model.DeliveryReceipt;
import io.crisislink.model.DeliveryStatus;
import io.crisislink.model.MessageKind;
import io.crisislink.model.MessagePriority;
import io.crisislink.model.Role;
import io.crisislink.model.SessionId;
import io.crisislink.observability.LatencyRecorder;
import io.crisislink.registry.ConnectionRegistry;
import io.crisislink.resilience.Backoff;
import io.crisislink.resilience.RateLimiter;
import io.crisislink.session.CrisisSession;
import io.crisislink.storage.AsyncPersistence;
import io.crisislink.transport.Transport;
import io.crisislink.transport.TransportException;
import io.crisislink.util.SerialExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Ordered, acknowledged delivery of session messages.
 * <p>
 * Every session owns an outbox drained by its own {@link SerialExecutor} over the shared
 * worker pool. A message goes to the other side of the session: what the person writes
 * travels over the volunteer's link, what the volunteer or a supervisor writes travels
 * over the person's link. Each side has its own FIFO lane with its own offline state, so
 * a dropped volunteer link holds the person's messages (head included) while replies
 * keep flowing, and {@link #resumeLink} flushes the held lane in order. Until a volunteer
 * is matched the person's messages wait in the volunteer lane.
 */
public final class DeliveryPipeline implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DeliveryPipeline.class);
    private static final int LATENCY_SAMPLES = 4096;

    private final CrisisLinkSettings settings;
    private final ConnectionRegistry registry;
    private final EventBus events;
    private final RateLimiter rateLimiter;
    private final PayloadCodec codec;
    private final AsyncPersistence persistence;
    private final LoadMonitor loadMonitor;
    private final Executor workers;
    private final ScheduledExecutorService scheduler;
    private final LongSupplier clock;
    private final LatencyRecorder latency;
    private final Map<SessionId, SessionOutbox> outboxes = new ConcurrentHashMap<>();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong queuedOffline = new AtomicLong();
    private final AtomicLong droppedBestEffort = new AtomicLong();
    private volatile Consumer<ConnectionId> linkLossHandler = id -> {
    };

    public DeliveryPipeline(
            CrisisLinkSettings settings,
            ConnectionRegistry registry,
            EventBus events,
            RateLimiter rateLimiter,
            PayloadCodec codec,
            AsyncPersistence persistence,
            LoadMonitor loadMonitor,
            Executor workers,
            ScheduledExecutorService scheduler,
            LongSupplier clock
    ) {
        this.settings = settings;
        this.registry = registry;
        this.events = events;
        this.rateLimiter = rateLimiter;
        this.codec = codec;
        this.persistence = persistence;
        this.loadMonitor = loadMonitor;
        this.workers = workers;
        this.scheduler = scheduler;
        this.clock = clock;
        this.latency = new LatencyRecorder(LATENCY_SAMPLES, settings.deliveryBudgetMs());
    }

    /** Called with the link's connection id the first time a lane finds it down. */
    public void onLinkLost(Consumer<ConnectionId> handler) {
        this.linkLossHandler = handler;
    }

    /**
     * Accepts a message for delivery to the other side of the session. The returned
     * receipt completes when the recipient acknowledges it, when it is held offline
     * ({@link DeliveryStatus#QUEUED}), or exceptionally with {@code DELIVERY_FAILED} once
     * its retry budget is spent. Outbox capacity and rate limits are checked
     * synchronously, capacity first.
     */
    public CompletableFuture<DeliveryReceipt> submit(
            CrisisSession session,
            ConnectionId sender,
            Role senderRole,
            MessageKind kind,
            String content,
            DeliveryOptions options
    ) {
        DeliveryOptions opts = options == null ? DeliveryOptions.standard() : options;
        MessagePriority priority = opts.emergency() ? MessagePriority.EMERGENCY : opts.priority();
        SessionOutbox outbox = outboxes.computeIfAbsent(session.id(), id -> new SessionOutbox(session));
        if (!kind.isBestEffort() && !priority.isCritical() && outbox.depth.get() >= settings.messageQueueSize()) {
            throw CrisisLinkException.rateLimited(
                    "session " + session.id(),
                    "queue full (" + settings.messageQueueSize() + " pending)"
            );
        }
        PayloadCodec.Encoded encoded = codec.encode(content, settings.encryptionEnabled() || opts.encrypted());
        rateLimiter.acquire(sender, encoded.payload().length(), priority);

        Pending pending;
        try {
            synchronized (session) {
                CrisisMessage message = session.newMessage(
                        senderRole,
                        kind,
                        priority,
                        encoded.payload(),
                        encoded.encrypted(),
                        encoded.compressed(),
                        clock.getAsLong()
                );
                pending = new Pending(message, Side.recipientOf(senderRole), System.nanoTime());
                outbox.depth.incrementAndGet();
                outbox.serial.execute(() -> outbox.accept(pending));
            }
        } catch (CrisisLinkException e) {
            if (outbox.depth.get() == 0 && !session.isOpen()) {
                outboxes.remove(session.id(), outbox);
            }
            throw e;
        }
        if (!kind.isBestEffort()) {
            persistence.saveMessage(pending.message);
        }
        return pending.receipt;
    }

    /** Blocking form of {@link #submit}; unwraps the delivery failure. */
    public DeliveryReceipt send(
            CrisisSession session,
            ConnectionId sender,
            Role senderRole,
            MessageKind kind,
            String content,
            DeliveryOptions options
    ) {
        try {
            return submit(session, sender, senderRole, kind, content, options).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof CrisisLinkException crisis) {
                throw crisis;
            }
            throw e;
        }
    }

    /** Brings every lane addressed to the link back online and flushes it in order. */
    public void resumeLink(ConnectionId link) {
        for (SessionOutbox outbox : outboxes.values()) {
            outbox.serial.execute(() -> outbox.resume(link));
        }
    }

    /** Takes every lane addressed to the link offline, e.g. after a failed heartbeat. */
    public void suspendLink(ConnectionId link, String reason) {
        for (SessionOutbox outbox : outboxes.values()) {
            outbox.serial.execute(() -> outbox.suspend(link, reason));
        }
    }

    /**
     * The link will not come back: every message held for it fails with
     * {@code DELIVERY_FAILED}, and messages addressed to it later fail at once until the
     * link is resumed or the session gets another recipient.
     */
    public void abandonLink(ConnectionId link, String reason) {
        for (SessionOutbox outbox : outboxes.values()) {
            outbox.serial.execute(() -> outbox.abandon(link, reason));
        }
    }

    /** Re-reads the session's participants, e.g. after a volunteer was matched or left. */
    public void recipientsChanged(SessionId sessionId) {
        SessionOutbox outbox = outboxes.get(sessionId);
        if (outbox != null) {
            outbox.serial.execute(outbox::recheckRecipients);
        }
    }

    /**
     * Tears down the session's outbox. Typing and presence signals are dropped, pending
     * messages are still delivered while their link is up (only critical ones keep
     * retrying), and whatever cannot be delivered is marked failed. The future
     * completes when the outbox is empty.
     */
    public CompletableFuture<Void> close(SessionId sessionId) {
        SessionOutbox outbox = outboxes.get(sessionId);
        if (outbox == null) {
            return CompletableFuture.completedFuture(null);
        }
        outbox.serial.execute(outbox::beginClose);
        return outbox.closed.whenComplete((ignored, error) -> outboxes.remove(sessionId, outbox));
    }

    /** Fails whatever the outbox still holds and completes its close immediately. */
    public void forceClose(SessionId sessionId) {
        SessionOutbox outbox = outboxes.get(sessionId);
        if (outbox != null) {
            outbox.serial.execute(outbox::finishClose);
        }
    }

    /** Upper bound for a graceful {@link #close} while the links are up. */
    public long drainTimeoutMs() {
        return settings.maxAttempts() * (settings.maxBackoffMs() + settings.deliveryBudgetMs()) + 1_000L;
    }

    public int pending(SessionId sessionId) {
        SessionOutbox outbox = outboxes.get(sessionId);
        return outbox == null ? 0 : outbox.depth.get();
    }

    /** True while any lane of the session is holding messages for a missing link. */
    public boolean isOffline(SessionId sessionId) {
        SessionOutbox outbox = outboxes.get(sessionId);
        return outbox != null && outbox.anyOffline();
    }

    public LatencyRecorder latency() {
        return latency;
    }

    public PayloadCodec codec() {
        return codec;
    }

    public DeliveryStats stats() {
        long pendingTotal = 0L;
        for (SessionOutbox outbox : outboxes.values()) {
            pendingTotal += outbox.depth.get();
        }
        return new DeliveryStats(
                delivered.get(),
                failed.get(),
                queuedOffline.get(),
                droppedBestEffort.get(),
                pendingTotal,
                outboxes.size(),
                latency.snapshot()
        );
    }

    @Override
    public void close() {
        for (SessionOutbox outbox : outboxes.values()) {
            outbox.serial.execute(outbox::finishClose);
        }
    }

    private Instant now() {
        return Instant.ofEpochMilli(clock.getAsLong());
    }

    /** The side of the session a message is addressed to. */
    private enum Side {
        PERSON,
        VOLUNTEER;

        static Side recipientOf(Role sender) {
            return sender == Role.PERSON_IN_CRISIS ? VOLUNTEER : PERSON;
        }
    }

    private static final class Pending {
        private final CrisisMessage message;
        private final Side recipient;
        private final long enqueuedNanos;
        private final CompletableFuture<DeliveryReceipt> receipt = new CompletableFuture<>();
        private int attempts;
        private boolean heldOffline;

        private Pending(CrisisMessage message, Side recipient, long enqueuedNanos) {
            this.message = message;
            this.recipient = recipient;
            this.enqueuedNanos = enqueuedNanos;
        }

        private boolean bestEffort() {
            return message.kind().isBestEffort();
        }

        private long elapsedMs() {
            return (System.nanoTime() - enqueuedNanos) / 1_000_000L;
        }
    }

    /** Mutable state below, lanes included, is only touched from {@link #serial}. */
    private final class SessionOutbox {
        private final CrisisSession session;
        private final SessionId sessionId;
        private final SerialExecutor serial;
        private final AtomicInteger depth = new AtomicInteger();
        private final Map<Side, Lane> lanes = new EnumMap<>(Side.class);
        private final CompletableFuture<Void> closed = new CompletableFuture<>();
        private boolean closing;

        private SessionOutbox(CrisisSession session) {
            this.session = session;
            this.sessionId = session.id();
            this.serial = new SerialExecutor(workers, "outbox-" + sessionId);
            for (Side side : Side.values()) {
                lanes.put(side, new Lane(side));
            }
        }

        private void accept(Pending pending) {
            if (closed.isDone()) {
                finish(pending, CrisisLinkException.invalidState("session " + sessionId + " has ended"));
                return;
            }
            lanes.get(pending.recipient).accept(pending);
        }

        private void resume(ConnectionId link) {
            for (Lane lane : lanes.values()) {
                if (link.equals(lane.link())) {
                    lane.resume();
                }
            }
        }

        private void suspend(ConnectionId link, String reason) {
            for (Lane lane : lanes.values()) {
                if (link.equals(lane.link())) {
                    lane.goOffline(link, reason);
                }
            }
        }

        private void abandon(ConnectionId link, String reason) {
            for (Lane lane : lanes.values()) {
                if (link.equals(lane.link())) {
                    lane.abandon(link, reason);
                }
            }
            settleClose();
        }

        private void recheckRecipients() {
            for (Lane lane : lanes.values()) {
                if (lane.offline && !Objects.equals(lane.offlineLink, lane.link())) {
                    lane.resume();
                }
            }
        }

        private boolean anyOffline() {
            for (Lane lane : lanes.values()) {
                if (lane.offline) {
                    return true;
                }
            }
            return false;
        }

        private void beginClose() {
            if (closed.isDone()) {
                return;
            }
            closing = true;
            for (Lane lane : lanes.values()) {
                lane.prepareClose();
            }
            for (Lane lane : lanes.values()) {
                if (!lane.offline) {
                    lane.drain();
                }
            }
            settleClose();
        }

        /** Finishes a pending close once no lane can make further progress. */
        private void settleClose() {
            if (!closing || closed.isDone()) {
                return;
            }
            for (Lane lane : lanes.values()) {
                if (!lane.settled()) {
                    return;
                }
            }
            finishClose();
        }

        private void finishClose() {
            if (closed.isDone()) {
                return;
            }
            for (Lane lane : lanes.values()) {
                lane.failAll(CrisisLinkException.invalidState("session " + sessionId + " ended with message undelivered"));
            }
            closed.complete(null);
        }

        private void holdOffline(Pending pending) {
            pending.message.markQueued();
            if (pending.heldOffline) {
                return;
            }
            pending.heldOffline = true;
            queuedOffline.incrementAndGet();
            pending.receipt.complete(new DeliveryReceipt(
                    pending.message.id(),
                    sessionId,
                    pending.message.sequence(),
                    DeliveryStatus.QUEUED,
                    pending.attempts,
                    0L,
                    null
            ));
        }

        private void acknowledge(Pending pending, ConnectionId link) {
            Instant at = now();
            pending.message.markAcknowledged(at);
            long latencyMs = pending.elapsedMs();
            if (!pending.heldOffline) {
                latency.record(latencyMs);
            }
            loadMonitor.recordDelivery(true, latencyMs);
            delivered.incrementAndGet();
            depth.decrementAndGet();
            registry.touch(link);
            pending.receipt.complete(new DeliveryReceipt(
                    pending.message.id(),
                    sessionId,
                    pending.message.sequence(),
                    DeliveryStatus.ACKNOWLEDGED,
                    pending.attempts,
                    latencyMs,
                    at
            ));
            if (!pending.bestEffort()) {
                persistence.saveMessage(pending.message);
            }
            events.publish(new SessionEvent.MessageReceived(at, sessionId, pending.message));
        }

        private void finish(Pending pending, Throwable cause) {
            pending.message.markFailed();
            failed.incrementAndGet();
            depth.decrementAndGet();
            loadMonitor.recordDelivery(false, pending.elapsedMs());
            persistence.saveMessage(pending.message);
            CrisisLinkException error = CrisisLinkException.deliveryFailed(
                    pending.message.id().toString(),
                    pending.attempts,
                    cause
            );
            if (pending.receipt.completeExceptionally(error)) {
                logger.warn("Delivery failed for {} in session {} after {} attempt(s): {}",
                        pending.message.id(), sessionId, pending.attempts, cause.getMessage());
            } else {
                logger.warn("Queued message {} in session {} could not be delivered: {}",
                        pending.message.id(), sessionId, cause.getMessage());
            }
        }

        private void drop(Pending pending) {
            pending.message.markFailed();
            droppedBestEffort.incrementAndGet();
            depth.decrementAndGet();
            pending.receipt.complete(new DeliveryReceipt(
                    pending.message.id(),
                    sessionId,
                    pending.message.sequence(),
                    DeliveryStatus.FAILED,
                    pending.attempts,
                    pending.elapsedMs(),
                    null
            ));
        }

        /** FIFO of messages addressed to one side of the session. */
        private final class Lane {
            private final Side side;
            private final Deque<Pending> queue = new ArrayDeque<>();
            private volatile boolean offline;
            private ConnectionId offlineLink;
            private ConnectionId abandonedLink;
            private ScheduledFuture<?> retryTimer;
            private Object retryToken;

            private Lane(Side side) {
                this.side = side;
            }

            /** Current recipient connection; {@code null} while no volunteer is matched. */
            private ConnectionId link() {
                return side == Side.PERSON ? session.personConnection() : session.volunteerConnection().orElse(null);
            }

            private boolean abandoned() {
                return abandonedLink != null && abandonedLink.equals(link());
            }

            private boolean settled() {
                return retryToken == null && (offline || queue.isEmpty());
            }

            private void accept(Pending pending) {
                if (abandoned()) {
                    if (pending.bestEffort()) {
                        drop(pending);
                    } else {
                        finish(pending, new TransportException("link " + abandonedLink + " is gone"));
                    }
                    return;
                }
                if (offline && !Objects.equals(offlineLink, link())) {
                    resume();
                }
                if (offline) {
                    if (pending.bestEffort()) {
                        drop(pending);
                    } else {
                        queue.addLast(pending);
                        holdOffline(pending);
                    }
                    return;
                }
                queue.addLast(pending);
                drain();
            }

            private void drain() {
                while (!offline && retryToken == null && !queue.isEmpty()) {
                    Pending head = queue.peekFirst();
                    ConnectionId link = link();
                    if (link == null) {
                        goOffline(null, "no volunteer matched");
                        break;
                    }
                    Transport transport = registry.transportOf(link).filter(Transport::isOpen).orElse(null);
                    if (transport == null) {
                        goOffline(link, "link unavailable");
                        break;
                    }
                    head.attempts++;
                    head.message.markSent();
                    try {
                        transport.send(head.message);
                    } catch (TransportException e) {
                        if (!transport.isOpen()) {
                            head.attempts--;
                            goOffline(link, e.getMessage());
                            break;
                        }
                        head.message.incrementRetry();
                        head.message.markQueued();
                        if (head.bestEffort()) {
                            queue.pollFirst();
                            drop(head);
                            continue;
                        }
                        boolean mayRetry = !closing || head.message.priority().isCritical();
                        if (!mayRetry || head.attempts >= settings.maxAttempts()) {
                            queue.pollFirst();
                            finish(head, e);
                            continue;
                        }
                        if (scheduleRetry(head)) {
                            break;
                        }
                        continue;
                    }
                    queue.pollFirst();
                    acknowledge(head, link);
                }
                settleClose();
            }

            private boolean scheduleRetry(Pending head) {
                long delay = Backoff.delayMs(head.attempts, settings.baseBackoffMs(), settings.maxBackoffMs());
                Object token = new Object();
                try {
                    retryTimer = scheduler.schedule(
                            () -> serial.execute(() -> retryDue(token)),
                            delay,
                            TimeUnit.MILLISECONDS
                    );
                } catch (RejectedExecutionException e) {
                    queue.pollFirst();
                    finish(head, e);
                    return false;
                }
                retryToken = token;
                logger.debug("Retrying {} in {}ms (attempt {} of {})",
                        head.message.id(), delay, head.attempts + 1, settings.maxAttempts());
                return true;
            }

            private void retryDue(Object token) {
                if (retryToken != token) {
                    return;
                }
                retryToken = null;
                retryTimer = null;
                drain();
            }

            private void cancelRetry() {
                if (retryTimer != null) {
                    retryTimer.cancel(false);
                }
                retryTimer = null;
                retryToken = null;
            }

            private void goOffline(ConnectionId link, String reason) {
                if (closed.isDone()) {
                    return;
                }
                boolean wasOnline = !offline;
                offline = true;
                offlineLink = link;
                cancelRetry();
                Iterator<Pending> it = queue.iterator();
                while (it.hasNext()) {
                    Pending pending = it.next();
                    if (pending.bestEffort()) {
                        it.remove();
                        drop(pending);
                    } else {
                        holdOffline(pending);
                    }
                }
                if (wasOnline) {
                    logger.info("Session {} {} lane offline ({}), holding {} message(s)",
                            sessionId, side, reason, queue.size());
                    if (link != null) {
                        linkLossHandler.accept(link);
                    }
                }
                settleClose();
            }

            private void resume() {
                if (closed.isDone()) {
                    return;
                }
                abandonedLink = null;
                if (offline) {
                    offline = false;
                    offlineLink = null;
                    logger.info("Session {} {} lane back online, flushing {} queued message(s)",
                            sessionId, side, queue.size());
                }
                drain();
            }

            private void abandon(ConnectionId link, String reason) {
                if (closed.isDone()) {
                    return;
                }
                abandonedLink = link;
                offline = true;
                offlineLink = link;
                int held = queue.size();
                failAll(new TransportException("link " + link + " lost: " + reason));
                if (held > 0) {
                    logger.warn("Session {} {} lane gave up on {} ({}), failed {} held message(s)",
                            sessionId, side, link, reason, held);
                }
            }

            private void prepareClose() {
                queue.removeIf(pending -> {
                    if (pending.bestEffort()) {
                        drop(pending);
                        return true;
                    }
                    return false;
                });
                Pending head = queue.peekFirst();
                if (retryToken != null && head != null && !head.message.priority().isCritical()) {
                    cancelRetry();
                    queue.pollFirst();
                    finish(head, CrisisLinkException.invalidState("session " + sessionId + " ended before retry"));
                }
            }

            private void failAll(Throwable cause) {
                cancelRetry();
                Pending pending;
                while ((pending = queue.pollFirst()) != null) {
                    if (pending.bestEffort()) {
                        drop(pending);
                    } else {
                        finish(pending, cause);
                    }
                }
            }
        }
    }
}
