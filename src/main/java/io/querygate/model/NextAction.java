package io.querygate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NextAction {
    NONE("none"),
    REVISE_QUERY("revise_query"),
    NARROW_SCOPE("narrow_scope"),
    PREVIEW_THEN_APPROVE("preview_then_approve"),
    WAIT_OR_REDUCE_COST("wait_or_reduce_cost");

    private final String wireName;

    NextAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static NextAction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        for (NextAction value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown next action: " + raw);
    }
}
