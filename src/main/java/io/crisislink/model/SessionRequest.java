package io.crisislink.model;

public record SessionRequest(int severity, boolean emergency, boolean anonymous) {
    public SessionRequest {
        severity = Math.max(1, Math.min(10, severity));
    }

    public static SessionRequest of(int severity) {
        return new SessionRequest(severity, false, true);
    }
}
