package io.crisislink.failover;

public enum Stability {
    STABLE,
    UNSTABLE,
    FAILED
}
