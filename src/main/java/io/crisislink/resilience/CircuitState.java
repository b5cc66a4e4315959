package io.crisislink.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
