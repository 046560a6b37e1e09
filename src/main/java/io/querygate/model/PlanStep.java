package io.querygate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One step of a plan. {@code tool} is nullable so that a malformed plan can still be read and then
 * reported by validation.
 */
public record PlanStep(
        int stepId,
        Tool tool,
        Map<String, Object> inputs,
        List<String> riskFlags
) {
    public static final String SQL_INPUT = "sql";
    public static final String ESTIMATED_BYTES_INPUT = "estimated_bytes";

    public PlanStep {
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        riskFlags = riskFlags == null ? List.of() : List.copyOf(riskFlags);
    }

    public static PlanStep query(int stepId, String sql) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put(SQL_INPUT, sql);
        return new PlanStep(stepId, Tool.EXECUTE_QUERY, inputs, List.of());
    }

    /** Name used for outcomes, backend calls and idempotency keys. */
    @JsonIgnore
    public String name() {
        return "step_" + stepId;
    }

    @JsonIgnore
    public String sql() {
        Object raw = inputs.get(SQL_INPUT);
        return raw == null ? null : raw.toString();
    }

    public PlanStep withInput(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(inputs);
        copy.put(key, value);
        return new PlanStep(stepId, tool, copy, riskFlags);
    }
}
