package io.crisislink.storage;

import io.crisislink.model.CrisisMessage;
import io.crisislink.model.EscalationEvent;
import io.crisislink.model.SessionSummary;
import io.crisislink.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes to the session store on a single background thread so persistence never sits
 * on the delivery or escalation path. Failures are logged and counted, not thrown.
 */
public final class AsyncPersistence implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AsyncPersistence.class);

    private final SessionStore store;
    private final ExecutorService writer;
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public AsyncPersistence(SessionStore store) {
        this.store = store;
        this.writer = Executors.newSingleThreadExecutor(new NamedThreadFactory("crisislink-persistence"));
    }

    public SessionStore store() {
        return store;
    }

    public void saveMessage(CrisisMessage message) {
        submit("message " + message.id(), () -> store.saveMessage(message));
    }

    public void saveEscalation(EscalationEvent event) {
        submit("escalation " + event.alertId(), () -> store.saveEscalation(event));
    }

    public void saveSessionSummary(SessionSummary summary) {
        submit("session " + summary.sessionId(), () -> store.saveSessionSummary(summary));
    }

    /** Waits until every write submitted so far has been attempted. */
    public boolean flush(long timeoutMs) {
        Future<?> marker;
        try {
            marker = writer.submit(() -> {
            });
        } catch (RejectedExecutionException e) {
            return true;
        }
        try {
            marker.get(timeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (TimeoutException e) {
            return false;
        } catch (Exception e) {
            throw new RuntimeException("Failed to flush persistence queue", e);
        }
    }

    public long writtenTotal() {
        return written.get();
    }

    public long failedTotal() {
        return failed.get();
    }

    private void submit(String what, Runnable write) {
        try {
            writer.execute(() -> {
                try {
                    write.run();
                    written.incrementAndGet();
                } catch (RuntimeException e) {
                    failed.incrementAndGet();
                    logger.error("Failed to persist {}", what, e);
                }
            });
        } catch (RejectedExecutionException e) {
            failed.incrementAndGet();
            logger.warn("Persistence closed, dropped write of {}", what);
        }
    }

    @Override
    public void close() {
        flush(10_000L);
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
