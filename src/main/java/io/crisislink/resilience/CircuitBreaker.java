package io.crisislink.resilience;

import io.crisislink.error.CrisisLinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.function.LongSupplier;

/**
 * Guards one downstream dependency. Opens after {@code failureThreshold} failures,
 * lets calls through again as a half-open trial once the cooldown has elapsed, and
 * closes after {@code halfOpenSuccesses} consecutive trial successes.
 */
public final class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final long cooldownMs;
    private final int halfOpenSuccesses;
    private final LongSupplier clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int trialSuccesses;
    private long lastFailureAtMs;
    private long openedAtMs;
    private long rejectedTotal;

    public CircuitBreaker(String name, int failureThreshold, long cooldownMs, int halfOpenSuccesses, LongSupplier clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.cooldownMs = Math.max(1L, cooldownMs);
        this.halfOpenSuccesses = Math.max(1, halfOpenSuccesses);
        this.clock = clock;
    }

    public String name() {
        return name;
    }

    public <T> T call(Callable<T> action) {
        if (!tryAcquire()) {
            throw CrisisLinkException.serviceUnavailable(name);
        }
        try {
            T result = action.call();
            recordSuccess();
            return result;
        } catch (RuntimeException e) {
            recordFailure();
            throw e;
        } catch (Exception e) {
            recordFailure();
            throw new RuntimeException("Call through circuit " + name + " failed", e);
        }
    }

    /**
     * Returns whether a call may proceed right now. Callers that get {@code true} must
     * report the outcome through {@link #recordSuccess()} or {@link #recordFailure()}.
     */
    public synchronized boolean tryAcquire() {
        if (state == CircuitState.OPEN) {
            if (clock.getAsLong() - openedAtMs >= cooldownMs) {
                transition(CircuitState.HALF_OPEN);
                trialSuccesses = 0;
                return true;
            }
            rejectedTotal++;
            return false;
        }
        return true;
    }

    public synchronized void recordSuccess() {
        switch (state) {
            case HALF_OPEN -> {
                trialSuccesses++;
                if (trialSuccesses >= halfOpenSuccesses) {
                    failureCount = 0;
                    trialSuccesses = 0;
                    transition(CircuitState.CLOSED);
                }
            }
            case CLOSED -> failureCount = 0;
            case OPEN -> {
                // Late completion of a call admitted before the circuit opened.
            }
        }
    }

    public synchronized void recordFailure() {
        long now = clock.getAsLong();
        lastFailureAtMs = now;
        switch (state) {
            case HALF_OPEN -> open(now);
            case CLOSED -> {
                failureCount++;
                if (failureCount >= failureThreshold) {
                    open(now);
                }
            }
            case OPEN -> failureCount++;
        }
    }

    public synchronized CircuitState state() {
        if (state == CircuitState.OPEN && clock.getAsLong() - openedAtMs >= cooldownMs) {
            return CircuitState.HALF_OPEN;
        }
        return state;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(name, state(), failureCount, trialSuccesses, lastFailureAtMs, openedAtMs, rejectedTotal);
    }

    private void open(long now) {
        openedAtMs = now;
        trialSuccesses = 0;
        transition(CircuitState.OPEN);
    }

    private void transition(CircuitState next) {
        if (state != next) {
            logger.info("Circuit {} {} -> {} (failures={})", name, state, next, failureCount);
            state = next;
        }
    }

    public record Snapshot(
            String name,
            CircuitState state,
            int failureCount,
            int trialSuccesses,
            long lastFailureAtMs,
            long openedAtMs,
            long rejectedTotal
    ) {
    }
}
