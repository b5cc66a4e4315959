package io.crisislink.model;

public enum MessageKind {
    CHAT,
    TYPING,
    PRESENCE,
    SYSTEM;

    /** Typing and presence signals get one attempt and are never queued offline. */
    public boolean isBestEffort() {
        return this == TYPING || this == PRESENCE;
    }
}
