package io.crisislink.model;

import java.util.List;

public record EmergencyChannel(
        String id,
        ChannelKind kind,
        String reference,
        int minSeverity
) {
    public EmergencyChannel {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("channel id cannot be empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("channel kind cannot be null: " + id);
        }
        reference = reference == null ? "" : reference.trim();
        minSeverity = Math.max(1, Math.min(10, minSeverity));
    }

    public static List<EmergencyChannel> defaults() {
        return List.of(
                new EmergencyChannel("hotline-988", ChannelKind.HOTLINE, "988", 8),
                new EmergencyChannel("crisis-text-741741", ChannelKind.CRISIS_TEXT, "text HOME to 741741", 8),
                new EmergencyChannel("supervisor-on-call", ChannelKind.SUPERVISOR, "supervisor", 1),
                new EmergencyChannel("emergency-services", ChannelKind.EMERGENCY_SERVICES, "911", 9)
        );
    }
}
