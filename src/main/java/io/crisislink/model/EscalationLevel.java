package io.crisislink.model;

public enum EscalationLevel {
    HIGH,
    CRITICAL,
    EMERGENCY;

    public static EscalationLevel forSeverity(int severity) {
        if (severity >= 9) {
            return EMERGENCY;
        }
        if (severity >= 8) {
            return CRITICAL;
        }
        return HIGH;
    }
}
