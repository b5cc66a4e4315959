package io.crisislink.failover;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding window over recent handshake and delivery outcomes. Rates are percentages.
 * Until a window holds enough samples it is treated as healthy, so a single early
 * failure cannot flip the system to {@link Stability#FAILED}.
 */
public final class LoadMonitor {
    private static final Logger logger = LoggerFactory.getLogger(LoadMonitor.class);
    static final int DEFAULT_WINDOW = 1000;
    static final int MIN_SAMPLES = 20;

    private final Window handshakes;
    private final Window deliveries;
    private volatile Stability lastStability = Stability.STABLE;

    public LoadMonitor() {
        this(DEFAULT_WINDOW);
    }

    public LoadMonitor(int window) {
        this.handshakes = new Window(window);
        this.deliveries = new Window(window);
    }

    public void recordConnection(boolean success, long handshakeMs) {
        handshakes.record(success, handshakeMs);
    }

    public void recordDelivery(boolean success, long latencyMs) {
        deliveries.record(success, latencyMs);
    }

    public LoadReport report() {
        Window.View conn = handshakes.view();
        Window.View del = deliveries.view();
        double connectionRate = conn.successRate();
        double deliveryRate = del.successRate();
        Stability stability = classify(
                conn.samples() < MIN_SAMPLES ? 100.0d : connectionRate,
                del.samples() < MIN_SAMPLES ? 100.0d : deliveryRate
        );
        Stability previous = lastStability;
        if (stability != previous) {
            lastStability = stability;
            logger.warn("Load stability changed {} -> {} (connections={}%, delivery={}%)",
                    previous, stability, round(connectionRate), round(deliveryRate));
        }
        return new LoadReport(
                conn.samples(),
                connectionRate,
                conn.averageValue(),
                conn.maxValue(),
                del.samples(),
                deliveryRate,
                stability
        );
    }

    public Stability stability() {
        return report().stability();
    }

    public static Stability classify(double connectionRate, double deliveryRate) {
        if (connectionRate >= 95.0d && deliveryRate >= 98.0d) {
            return Stability.STABLE;
        }
        if (connectionRate >= 80.0d && deliveryRate >= 90.0d) {
            return Stability.UNSTABLE;
        }
        return Stability.FAILED;
    }

    private static double round(double value) {
        return Math.round(value * 10.0d) / 10.0d;
    }

    private static final class Window {
        private final boolean[] outcomes;
        private final long[] values;
        private int next;
        private int size;

        private Window(int capacity) {
            int n = Math.max(MIN_SAMPLES, capacity);
            this.outcomes = new boolean[n];
            this.values = new long[n];
        }

        private synchronized void record(boolean success, long value) {
            outcomes[next] = success;
            values[next] = Math.max(0L, value);
            next = (next + 1) % outcomes.length;
            size = Math.min(size + 1, outcomes.length);
        }

        private synchronized View view() {
            if (size == 0) {
                return new View(0, 100.0d, 0.0d, 0L);
            }
            int ok = 0;
            long sum = 0L;
            long max = 0L;
            for (int i = 0; i < size; i++) {
                if (outcomes[i]) {
                    ok++;
                    sum += values[i];
                    max = Math.max(max, values[i]);
                }
            }
            double average = ok == 0 ? 0.0d : (double) sum / ok;
            return new View(size, 100.0d * ok / size, average, max);
        }

        private record View(int samples, double successRate, double averageValue, long maxValue) {
        }
    }
}
