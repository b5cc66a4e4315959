package io.crisislink.model;

public enum DeliveryStatus {
    QUEUED,
    SENT,
    ACKNOWLEDGED,
    FAILED
}
