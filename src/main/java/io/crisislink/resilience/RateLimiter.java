package io.crisislink.resilience;

import io.crisislink.config.CrisisLinkSettings.RateLimitSettings;
import io.crisislink.error.CrisisLinkException;
import io.crisislink.model.ConnectionId;
import io.crisislink.model.MessagePriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Per-connection message and byte ceilings over fixed one-second and one-minute windows.
 * Crossing any ceiling bans the connection for the configured duration. Emergency
 * traffic is never limited.
 */
public final class RateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimitSettings settings;
    private final LongSupplier clock;
    private final Map<ConnectionId, Window> windows = new ConcurrentHashMap<>();
    private final AtomicLong rejectedTotal = new AtomicLong();
    private final AtomicLong warningsTotal = new AtomicLong();

    public RateLimiter(RateLimitSettings settings, LongSupplier clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public void acquire(ConnectionId connectionId, int bytes, MessagePriority priority) {
        if (priority == MessagePriority.EMERGENCY) {
            return;
        }
        Window window = windows.computeIfAbsent(connectionId, id -> new Window());
        String reason;
        synchronized (window) {
            reason = window.admit(clock.getAsLong(), Math.max(0, bytes));
        }
        if (reason != null) {
            rejectedTotal.incrementAndGet();
            logger.warn("Rate limit hit for {}: {}", connectionId, reason);
            throw CrisisLinkException.rateLimited(connectionId.toString(), reason);
        }
    }

    public Status status(ConnectionId connectionId) {
        Window window = windows.get(connectionId);
        if (window == null) {
            return new Status(connectionId, 0, 0, 0L, 0, false, 0L);
        }
        synchronized (window) {
            long now = clock.getAsLong();
            window.roll(now);
            return new Status(
                    connectionId,
                    window.secondCount,
                    window.minuteCount,
                    window.secondBytes,
                    window.warnings,
                    window.bannedUntilMs > now,
                    window.bannedUntilMs
            );
        }
    }

    public void forget(ConnectionId connectionId) {
        windows.remove(connectionId);
    }

    public long rejectedTotal() {
        return rejectedTotal.get();
    }

    public long warningsTotal() {
        return warningsTotal.get();
    }

    private final class Window {
        private long secondStartMs;
        private long minuteStartMs;
        private int secondCount;
        private int minuteCount;
        private long secondBytes;
        private int warnings;
        private long bannedUntilMs;

        private String admit(long now, int bytes) {
            if (bannedUntilMs > now) {
                return "banned for another " + (bannedUntilMs - now) + "ms";
            }
            roll(now);
            if (secondCount + 1 > settings.maxMessagesPerSecond()) {
                return ban(now, "messages per second above " + settings.maxMessagesPerSecond());
            }
            if (minuteCount + 1 > settings.maxMessagesPerMinute()) {
                return ban(now, "messages per minute above " + settings.maxMessagesPerMinute());
            }
            if (secondBytes + bytes > settings.maxBytesPerSecond()) {
                return ban(now, "bytes per second above " + settings.maxBytesPerSecond());
            }
            secondCount++;
            minuteCount++;
            secondBytes += bytes;
            if (secondCount >= settings.maxMessagesPerSecond() * settings.warningThreshold()
                    || minuteCount >= settings.maxMessagesPerMinute() * settings.warningThreshold()) {
                warnings++;
                warningsTotal.incrementAndGet();
            }
            return null;
        }

        private void roll(long now) {
            if (now - secondStartMs >= 1_000L) {
                secondStartMs = now;
                secondCount = 0;
                secondBytes = 0L;
            }
            if (now - minuteStartMs >= 60_000L) {
                minuteStartMs = now;
                minuteCount = 0;
            }
        }

        private String ban(long now, String reason) {
            bannedUntilMs = now + settings.banDurationMs();
            return reason;
        }
    }

    public record Status(
            ConnectionId connectionId,
            int messagesThisSecond,
            int messagesThisMinute,
            long bytesThisSecond,
            int warnings,
            boolean banned,
            long bannedUntilMs
    ) {
    }
}
