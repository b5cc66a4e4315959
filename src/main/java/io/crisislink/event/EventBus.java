package io.crisislink.event;

import io.crisislink.util.SerialExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

public final class EventBus {
    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private final Executor executor;
    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong listenerFailures = new AtomicLong();

    public EventBus(Executor executor) {
        this.executor = executor;
    }

    public Subscription subscribe(Consumer<SessionEvent> listener) {
        return subscribe(event -> true, listener);
    }

    public Subscription subscribe(Predicate<SessionEvent> filter, Consumer<SessionEvent> listener) {
        Subscriber subscriber = new Subscriber(
                filter,
                listener,
                new SerialExecutor(executor, "event-subscriber-" + (subscribers.size() + 1))
        );
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public void publish(SessionEvent event) {
        published.incrementAndGet();
        for (Subscriber subscriber : subscribers) {
            if (!subscriber.filter().test(event)) {
                continue;
            }
            subscriber.queue().execute(() -> deliver(subscriber, event));
        }
    }

    public long publishedCount() {
        return published.get();
    }

    public long listenerFailures() {
        return listenerFailures.get();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private void deliver(Subscriber subscriber, SessionEvent event) {
        try {
            subscriber.listener().accept(event);
        } catch (RuntimeException e) {
            listenerFailures.incrementAndGet();
            logger.warn("Event listener failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private record Subscriber(
            Predicate<SessionEvent> filter,
            Consumer<SessionEvent> listener,
            SerialExecutor queue
    ) {
    }
}
