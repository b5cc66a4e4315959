package io.crisislink.resilience;

import java.util.concurrent.ThreadLocalRandom;

public final class Backoff {
    private Backoff() {
    }

    /**
     * Doubling delay for the given 1-based attempt, capped at {@code maxBackoffMs}, plus
     * up to half the delay again as jitter. Never exceeds the cap.
     */
    public static long delayMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
        long base = Math.max(1L, baseBackoffMs);
        long max = Math.max(base, maxBackoffMs);
        long backoff = base;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= max / 2L) {
                backoff = max;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, max);
        long jitter = ThreadLocalRandom.current().nextLong(0L, backoff / 2L + 1L);
        return Math.min(max, backoff + jitter);
    }
}
