package io.querygate.model;

import java.util.Objects;

public record IdempotencyKey(String value) {
    public IdempotencyKey {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("idempotency key cannot be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
