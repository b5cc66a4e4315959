package io.crisislink.observability;

import java.util.Arrays;

/**
 * Keeps the most recent latency samples in a ring buffer and reports percentiles and
 * the share of samples within a budget.
 */
public final class LatencyRecorder {
    private final long[] samples;
    private final long budgetMs;
    private int next;
    private int size;
    private long total;
    private long withinBudget;

    public LatencyRecorder(int capacity, long budgetMs) {
        this.samples = new long[Math.max(16, capacity)];
        this.budgetMs = budgetMs;
    }

    public synchronized void record(long latencyMs) {
        long value = Math.max(0L, latencyMs);
        samples[next] = value;
        next = (next + 1) % samples.length;
        size = Math.min(size + 1, samples.length);
        total++;
        if (value < budgetMs) {
            withinBudget++;
        }
    }

    public synchronized Snapshot snapshot() {
        if (size == 0) {
            return new Snapshot(0L, 0L, 0L, 0L, 0L, 1.0d, budgetMs);
        }
        long[] sorted = Arrays.copyOf(samples, size);
        Arrays.sort(sorted);
        return new Snapshot(
                total,
                percentile(sorted, 0.50d),
                percentile(sorted, 0.95d),
                percentile(sorted, 0.99d),
                sorted[sorted.length - 1],
                (double) withinBudget / (double) total,
                budgetMs
        );
    }

    private static long percentile(long[] sorted, double quantile) {
        int index = (int) Math.ceil(quantile * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(sorted.length - 1, index))];
    }

    public record Snapshot(
            long count,
            long p50Ms,
            long p95Ms,
            long p99Ms,
            long maxMs,
            double withinBudgetRatio,
            long budgetMs
    ) {
    }
}
