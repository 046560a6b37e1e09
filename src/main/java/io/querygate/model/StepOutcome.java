package io.querygate.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one plan step. {@code output} is deep-copied into unmodifiable collections, so it keeps
 * matching {@code outputHash} after the outcome is cached or handed out.
 */
public record StepOutcome(
        String stepName,
        Tool tool,
        StepStatus status,
        Map<String, Object> output,
        String outputHash,
        Instant startedAt,
        Instant finishedAt,
        int retryCount,
        String error
) {
    public StepOutcome {
        Objects.requireNonNull(stepName, "stepName");
        Objects.requireNonNull(status, "status");
        output = output == null ? Map.of() : freezeMap(output);
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative");
        }
        if (status == StepStatus.FAILED && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("failed outcome requires an error");
        }
        if (status == StepStatus.SUCCESS && error != null) {
            throw new IllegalArgumentException("successful outcome cannot carry an error");
        }
    }

    public boolean succeeded() {
        return status == StepStatus.SUCCESS;
    }

    public long bytesScanned() {
        Object raw = output.get("bytes_scanned");
        if (raw instanceof Number number) {
            return Math.max(0L, number.longValue());
        }
        return 0L;
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    // row values may be null, which rules out Map.copyOf and List.copyOf
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
