package io.crisislink.model;

public record DeliveryOptions(boolean emergency, boolean encrypted, MessagePriority priority) {
    public DeliveryOptions {
        if (priority == null) {
            priority = emergency ? MessagePriority.EMERGENCY : MessagePriority.NORMAL;
        }
    }

    public static DeliveryOptions standard() {
        return new DeliveryOptions(false, false, MessagePriority.NORMAL);
    }

    public static DeliveryOptions emergencyMessage() {
        return new DeliveryOptions(true, false, MessagePriority.EMERGENCY);
    }

    public static DeliveryOptions withPriority(MessagePriority priority) {
        return new DeliveryOptions(priority == MessagePriority.EMERGENCY, false, priority);
    }
}
