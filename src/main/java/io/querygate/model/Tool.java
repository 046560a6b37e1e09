package io.querygate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tools a plan step may invoke. Executors dispatch with an exhaustive {@code switch}, so adding a
 * constant forces every dispatch site to handle it.
 */
public enum Tool {
    EXECUTE_QUERY("execute_query", true);

    private final String wireName;
    private final boolean sqlBearing;

    Tool(String wireName, boolean sqlBearing) {
        this.wireName = wireName;
        this.sqlBearing = sqlBearing;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean sqlBearing() {
        return sqlBearing;
    }

    @JsonCreator
    public static Tool fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Tool cannot be empty");
        }
        for (Tool value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown tool: " + raw);
    }
}
