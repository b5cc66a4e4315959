package io.crisislink.model;

public enum MessagePriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    URGENT(4),
    CRITICAL(5),
    EMERGENCY(6);

    private final int level;

    MessagePriority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public boolean isCritical() {
        return level >= CRITICAL.level;
    }

    public static MessagePriority forSeverity(int severity) {
        if (severity >= 9) {
            return CRITICAL;
        }
        if (severity >= 7) {
            return URGENT;
        }
        if (severity >= 5) {
            return HIGH;
        }
        return NORMAL;
    }
}
