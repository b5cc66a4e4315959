package io.crisislink.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.UUID;

public record ConnectionId(String value) {
    public ConnectionId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("connection id cannot be empty");
        }
    }

    public static ConnectionId of(String value) {
        return new ConnectionId(value);
    }

    public static ConnectionId random() {
        return new ConnectionId("conn-" + UUID.randomUUID());
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
