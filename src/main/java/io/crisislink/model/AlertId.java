package io.crisislink.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.UUID;

public record AlertId(String value) {
    public AlertId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("alert id cannot be empty");
        }
    }

    public static AlertId of(String value) {
        return new AlertId(value);
    }

    public static AlertId random() {
        return new AlertId("alert-" + UUID.randomUUID());
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
