package io.crisislink.resilience;

import io.crisislink.config.CrisisLinkSettings.RateLimitSettings;
import io.crisislink.error.CrisisLinkException;
import io.crisislink.error.ErrorKind;
import io.crisislink.model.ConnectionId;
import io.crisislink.model.MessagePriority;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

final class RateLimiterTest {

    @Test
    void perSecondCeilingBansTheConnection() {
        AtomicLong clock = new AtomicLong(10_000L);
        RateLimiter limiter = new RateLimiter(new RateLimitSettings(3, 100, 64_000L, 1_000L, 0.8d), clock::get);
        ConnectionId conn = ConnectionId.random();

        for (int i = 0; i < 3; i++) {
            limiter.acquire(conn, 10, MessagePriority.NORMAL);
        }
        CrisisLinkException limited = Assertions.assertThrows(
                CrisisLinkException.class,
                () -> limiter.acquire(conn, 10, MessagePriority.NORMAL)
        );
        Assertions.assertEquals(ErrorKind.RATE_LIMITED, limited.kind());
        Assertions.assertTrue(limiter.status(conn).banned());
        Assertions.assertEquals(1L, limiter.rejectedTotal());
        Assertions.assertEquals(1L, limiter.warningsTotal());

        clock.addAndGet(500L);
        Assertions.assertThrows(CrisisLinkException.class, () -> limiter.acquire(conn, 10, MessagePriority.HIGH));

        clock.addAndGet(600L);
        limiter.acquire(conn, 10, MessagePriority.NORMAL);
        Assertions.assertFalse(limiter.status(conn).banned());
    }

    @Test
    void emergencyTrafficIsNeverLimited() {
        AtomicLong clock = new AtomicLong(10_000L);
        RateLimiter limiter = new RateLimiter(new RateLimitSettings(1, 1, 1L, 60_000L, 0.8d), clock::get);
        ConnectionId conn = ConnectionId.random();

        limiter.acquire(conn, 0, MessagePriority.NORMAL);
        Assertions.assertThrows(CrisisLinkException.class, () -> limiter.acquire(conn, 0, MessagePriority.NORMAL));
        for (int i = 0; i < 20; i++) {
            limiter.acquire(conn, 4_096, MessagePriority.EMERGENCY);
        }
    }

    @Test
    void byteCeilingIsEnforcedSeparately() {
        RateLimiter limiter = new RateLimiter(new RateLimitSettings(100, 1_000, 100L, 0L, 0.8d), () -> 5_000L);
        ConnectionId conn = ConnectionId.random();
        limiter.acquire(conn, 60, MessagePriority.NORMAL);

        CrisisLinkException limited = Assertions.assertThrows(
                CrisisLinkException.class,
                () -> limiter.acquire(conn, 60, MessagePriority.NORMAL)
        );
        Assertions.assertTrue(limited.getMessage().contains("bytes per second"));
    }

    @Test
    void forgettingAConnectionClearsItsWindow() {
        AtomicLong clock = new AtomicLong(10_000L);
        RateLimiter limiter = new RateLimiter(new RateLimitSettings(1, 10, 1_000L, 60_000L, 0.8d), clock::get);
        ConnectionId conn = ConnectionId.random();
        limiter.acquire(conn, 1, MessagePriority.NORMAL);
        Assertions.assertThrows(CrisisLinkException.class, () -> limiter.acquire(conn, 1, MessagePriority.NORMAL));

        limiter.forget(conn);
        limiter.acquire(conn, 1, MessagePriority.NORMAL);
        Assertions.assertEquals(1, limiter.status(conn).messagesThisSecond());
    }
}
