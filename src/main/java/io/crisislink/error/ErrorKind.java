package io.crisislink.error;

public enum ErrorKind {
    HANDSHAKE_TIMEOUT,
    CAPACITY_EXCEEDED,
    ALREADY_CONNECTED,
    AUTHENTICATION_REJECTED,
    DELIVERY_FAILED,
    SERVICE_UNAVAILABLE,
    RATE_LIMITED,
    ESCALATION_CHANNEL_UNREACHABLE,
    SESSION_NOT_FOUND,
    INVALID_STATE,
    INVALID_REQUEST
}
