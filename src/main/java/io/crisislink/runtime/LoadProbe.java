package io.crisislink.runtime;

import io.crisislink.error.CrisisLinkException;
import io.crisislink.failover.ConnectionMetrics;
import io.crisislink.failover.LoadMonitor;
import io.crisislink.failover.Stability;
import io.crisislink.model.ConnectionId;
import io.crisislink.model.ConnectionInfo;
import io.crisislink.model.DeliveryOptions;
import io.crisislink.model.DeliveryReceipt;
import io.crisislink.model.Role;
import io.crisislink.model.SessionId;
import io.crisislink.model.SessionRequest;
import io.crisislink.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Opens many sessions at once, pairs a sample of them with a volunteer, sends one
 * message from the person on each and reports how the runtime held up. Probe
 * connections are disconnected afterwards.
 */
public final class LoadProbe {
    private static final Logger logger = LoggerFactory.getLogger(LoadProbe.class);

    private final CrisisLinkRuntime runtime;
    private final int concurrency;

    public LoadProbe(CrisisLinkRuntime runtime, int concurrency) {
        this.runtime = runtime;
        this.concurrency = Math.max(1, concurrency);
    }

    public Result run(int sessions, int sampleMessages) {
        int total = Math.max(1, sessions);
        long startNanos = System.nanoTime();
        ExecutorService pool = Executors.newFixedThreadPool(concurrency, new NamedThreadFactory("crisislink-probe"));
        try {
            String runId = Long.toHexString(System.nanoTime());
            List<Future<Opened>> opening = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                String participant = "probe-" + runId + "-" + i;
                opening.add(pool.submit(() -> open(participant)));
            }
            List<Opened> opened = new ArrayList<>();
            for (Future<Opened> future : opening) {
                Opened result = get(future);
                if (result != null) {
                    opened.add(result);
                }
            }

            int sample = Math.min(Math.max(0, sampleMessages), opened.size());
            Queue<ConnectionId> volunteers = new ConcurrentLinkedQueue<>();
            List<Future<Boolean>> sending = new ArrayList<>(sample);
            int stride = sample == 0 ? 1 : Math.max(1, opened.size() / sample);
            for (int i = 0; i < sample; i++) {
                Opened target = opened.get((i * stride) % opened.size());
                int n = i;
                String volunteer = "probe-vol-" + runId + "-" + n;
                sending.add(pool.submit(sendOne(target, volunteer, volunteers, "probe message " + n)));
            }
            int delivered = 0;
            for (Future<Boolean> future : sending) {
                if (Boolean.TRUE.equals(get(future))) {
                    delivered++;
                }
            }

            long[] handshakes = opened.stream().mapToLong(o -> o.metrics().handshakeMs()).sorted().toArray();
            List<Future<?>> closing = new ArrayList<>(opened.size());
            for (Opened o : opened) {
                closing.add(pool.submit(() -> runtime.disconnect(o.metrics().connectionId(), "probe_complete")));
            }
            for (Future<?> future : closing) {
                get(future);
            }
            for (ConnectionId volunteer : volunteers) {
                runtime.disconnect(volunteer, "probe_complete");
            }

            double connectionRate = 100.0d * opened.size() / total;
            double deliveryRate = sample == 0 ? 100.0d : 100.0d * delivered / sample;
            Result result = new Result(
                    total,
                    opened.size(),
                    connectionRate,
                    sample,
                    delivered,
                    deliveryRate,
                    percentile(handshakes, 0.95d),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos),
                    LoadMonitor.classify(connectionRate, deliveryRate)
            );
            logger.info("Load probe: {}/{} connected, {}/{} delivered, stability={}",
                    result.connected(), total, delivered, sample, result.stability());
            return result;
        } finally {
            pool.shutdownNow();
        }
    }

    private Opened open(String participant) {
        ConnectionMetrics metrics;
        try {
            metrics = runtime.connect(ConnectionInfo.anonymousPerson(participant));
        } catch (CrisisLinkException e) {
            logger.debug("Probe connect failed for {}: {}", participant, e.getMessage());
            return null;
        }
        try {
            SessionId sessionId = runtime.startSession(metrics.connectionId(), SessionRequest.of(3)).id();
            return new Opened(metrics, sessionId);
        } catch (CrisisLinkException e) {
            logger.debug("Probe session failed for {}: {}", participant, e.getMessage());
            runtime.disconnect(metrics.connectionId(), "probe_failed");
            return null;
        }
    }

    private Callable<Boolean> sendOne(Opened target, String volunteer, Queue<ConnectionId> volunteers, String content) {
        return () -> {
            try {
                ConnectionId volunteerId = runtime.connect(ConnectionInfo.volunteer(volunteer, "en")).connectionId();
                volunteers.add(volunteerId);
                runtime.matchVolunteer(target.sessionId(), volunteerId);
                DeliveryReceipt receipt = runtime.sendMessage(target.sessionId(), Role.PERSON_IN_CRISIS, content, DeliveryOptions.standard());
                return receipt.delivered();
            } catch (CrisisLinkException e) {
                logger.debug("Probe message failed on {}: {}", target.sessionId(), e.getMessage());
                return false;
            }
        };
    }

    private static <T> T get(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("load probe interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("load probe task failed", e.getCause());
        }
    }

    private static long percentile(long[] sorted, double quantile) {
        if (sorted.length == 0) {
            return 0L;
        }
        int index = (int) Math.ceil(quantile * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(sorted.length - 1, index))];
    }

    private record Opened(ConnectionMetrics metrics, SessionId sessionId) {
    }

    public record Result(
            int sessionsRequested,
            int connected,
            double connectionRate,
            int messagesSampled,
            int delivered,
            double deliveryRate,
            long handshakeP95Ms,
            long elapsedMs,
            Stability stability
    ) {
    }
}
