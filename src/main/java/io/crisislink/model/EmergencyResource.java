package io.crisislink.model;

import java.util.ArrayList;
import java.util.List;

public record EmergencyResource(String name, String contact, String description, boolean available24x7) {
    public static final EmergencyResource LIFELINE_988 = new EmergencyResource(
            "988 Suicide & Crisis Lifeline",
            "988",
            "Free, confidential support by call or text",
            true
    );
    public static final EmergencyResource CRISIS_TEXT_LINE = new EmergencyResource(
            "Crisis Text Line",
            "text HOME to 741741",
            "Text with a trained crisis counselor",
            true
    );
    public static final EmergencyResource EMERGENCY_SERVICES = new EmergencyResource(
            "Emergency Services",
            "911",
            "Immediate danger to life",
            true
    );

    public static List<EmergencyResource> forLevel(EscalationLevel level) {
        List<EmergencyResource> out = new ArrayList<>();
        if (level == EscalationLevel.EMERGENCY) {
            out.add(EMERGENCY_SERVICES);
        }
        out.add(LIFELINE_988);
        out.add(CRISIS_TEXT_LINE);
        return List.copyOf(out);
    }
}
