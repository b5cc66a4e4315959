package io.crisislink.resilience;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class BackoffTest {

    @Test
    void delayDoublesPerAttemptWithBoundedJitter() {
        for (int i = 0; i < 200; i++) {
            long first = Backoff.delayMs(1, 10L, 80L);
            long third = Backoff.delayMs(3, 10L, 80L);
            Assertions.assertTrue(first >= 10L && first <= 15L, "attempt 1 delay " + first);
            Assertions.assertTrue(third >= 40L && third <= 60L, "attempt 3 delay " + third);
        }
    }

    @Test
    void delayNeverExceedsTheCap() {
        for (int attempt = 1; attempt <= 40; attempt++) {
            long delay = Backoff.delayMs(attempt, 10L, 80L);
            Assertions.assertTrue(delay <= 80L, "attempt " + attempt + " delay " + delay);
        }
        Assertions.assertEquals(80L, Backoff.delayMs(10, 10L, 80L));
    }

    @Test
    void degenerateInputsStillYieldAPositiveDelay() {
        Assertions.assertEquals(1L, Backoff.delayMs(1, 0L, 0L));
        Assertions.assertEquals(50L, Backoff.delayMs(5, 50L, 10L));
    }
}
