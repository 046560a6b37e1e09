package io.querygate.model;

import java.time.Instant;
import java.util.Objects;

public record UsageEvent(String tenantId, Instant timestamp, long bytes) {
    public UsageEvent {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(timestamp, "timestamp");
        if (bytes < 0L) {
            throw new IllegalArgumentException("usage bytes must be non-negative: " + bytes);
        }
    }
}
