package io.crisislink.resilience;

import io.crisislink.config.CrisisLinkSettings;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

public final class CircuitBreakerRegistry {
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final long cooldownMs;
    private final int halfOpenSuccesses;
    private final LongSupplier clock;

    public CircuitBreakerRegistry(CrisisLinkSettings settings, LongSupplier clock) {
        this(settings.breakerFailureThreshold(), settings.breakerCooldownMs(), settings.breakerHalfOpenSuccesses(), clock);
    }

    public CircuitBreakerRegistry(int failureThreshold, long cooldownMs, int halfOpenSuccesses, LongSupplier clock) {
        this.failureThreshold = failureThreshold;
        this.cooldownMs = cooldownMs;
        this.halfOpenSuccesses = halfOpenSuccesses;
        this.clock = clock;
    }

    public CircuitBreaker get(String service) {
        return breakers.computeIfAbsent(service,
                name -> new CircuitBreaker(name, failureThreshold, cooldownMs, halfOpenSuccesses, clock));
    }

    public Map<String, CircuitState> states() {
        Map<String, CircuitState> out = new LinkedHashMap<>();
        new TreeMap<>(breakers).forEach((name, breaker) -> out.put(name, breaker.state()));
        return out;
    }

    public long openCount() {
        return breakers.values().stream().filter(b -> b.state() == CircuitState.OPEN).count();
    }
}
