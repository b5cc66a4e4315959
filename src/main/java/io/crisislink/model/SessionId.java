package io.crisislink.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.UUID;

public record SessionId(String value) {
    public SessionId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("session id cannot be empty");
        }
    }

    public static SessionId of(String value) {
        return new SessionId(value);
    }

    public static SessionId random() {
        return new SessionId("sess-" + UUID.randomUUID());
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
