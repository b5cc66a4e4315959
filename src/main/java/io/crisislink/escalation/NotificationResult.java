package io.crisislink.escalation;

public record NotificationResult(
        boolean reached,
        String detail
) {
    public static NotificationResult ok(String detail) {
        return new NotificationResult(true, detail);
    }

    public static NotificationResult failed(String detail) {
        return new NotificationResult(false, detail);
    }
}
