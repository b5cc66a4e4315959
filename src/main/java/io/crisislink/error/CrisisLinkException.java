package io.crisislink.error;

public final class CrisisLinkException extends RuntimeException {
    private final ErrorKind kind;

    public CrisisLinkException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CrisisLinkException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static CrisisLinkException handshakeTimeout(String participantId, long elapsedMs, Throwable cause) {
        return new CrisisLinkException(
                ErrorKind.HANDSHAKE_TIMEOUT,
                "handshake failed for " + participantId + " after " + elapsedMs + "ms",
                cause
        );
    }

    public static CrisisLinkException capacityExceeded(String what, int limit) {
        return new CrisisLinkException(ErrorKind.CAPACITY_EXCEEDED, what + " capacity exceeded (limit=" + limit + ")");
    }

    public static CrisisLinkException alreadyConnected(String participantId) {
        return new CrisisLinkException(ErrorKind.ALREADY_CONNECTED, "participant already connected: " + participantId);
    }

    public static CrisisLinkException authenticationRejected(String participantId) {
        return new CrisisLinkException(
                ErrorKind.AUTHENTICATION_REJECTED,
                "authentication required for participant: " + participantId
        );
    }

    public static CrisisLinkException deliveryFailed(String messageId, int attempts, Throwable cause) {
        return new CrisisLinkException(
                ErrorKind.DELIVERY_FAILED,
                "delivery failed for " + messageId + " after " + attempts + " attempts",
                cause
        );
    }

    public static CrisisLinkException serviceUnavailable(String service) {
        return new CrisisLinkException(ErrorKind.SERVICE_UNAVAILABLE, "circuit open for service: " + service);
    }

    public static CrisisLinkException rateLimited(String subject, String reason) {
        return new CrisisLinkException(ErrorKind.RATE_LIMITED, "rate limited " + subject + ": " + reason);
    }

    public static CrisisLinkException sessionNotFound(Object sessionId) {
        return new CrisisLinkException(ErrorKind.SESSION_NOT_FOUND, "session not found: " + sessionId);
    }

    public static CrisisLinkException invalidState(String message) {
        return new CrisisLinkException(ErrorKind.INVALID_STATE, message);
    }

    public static CrisisLinkException invalidRequest(String message) {
        return new CrisisLinkException(ErrorKind.INVALID_REQUEST, message);
    }
}
