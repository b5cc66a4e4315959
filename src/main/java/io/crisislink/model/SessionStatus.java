package io.crisislink.model;

public enum SessionStatus {
    WAITING,
    ACTIVE,
    ESCALATED,
    RESOLVED,
    ENDED;

    public boolean isTerminal() {
        return this == RESOLVED || this == ENDED;
    }
}
