package io.crisislink.model;

public enum ChannelKind {
    HOTLINE,
    CRISIS_TEXT,
    SUPERVISOR,
    EMERGENCY_SERVICES
}
