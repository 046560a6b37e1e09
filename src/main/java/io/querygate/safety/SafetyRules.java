package io.querygate.safety;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Static limits applied by {@link SqlSafetyAnalyzer}. Partitioned table names are matched
 * case-insensitively, either exactly or as a dotted suffix of a longer qualified name.
 */
public record SafetyRules(
        int defaultLimit,
        int maxJoinDepth,
        int maxSubqueryDepth,
        Map<String, String> partitionedTables,
        int partitionLookbackDays
) {
    public static final int DEFAULT_LIMIT = 10_000;
    public static final int DEFAULT_MAX_JOIN_DEPTH = 5;
    public static final int DEFAULT_MAX_SUBQUERY_DEPTH = 3;
    public static final int DEFAULT_LOOKBACK_DAYS = 30;
    public static final Map<String, String> DEFAULT_PARTITIONED_TABLES = Map.of(
            "analytics.events", "created_at",
            "analytics.orders", "created_at",
            "analytics.users", "created_at"
    );

    public SafetyRules {
        if (defaultLimit <= 0) {
            throw new IllegalArgumentException("defaultLimit must be positive: " + defaultLimit);
        }
        if (maxJoinDepth < 0 || maxSubqueryDepth < 0) {
            throw new IllegalArgumentException("depth limits must be non-negative");
        }
        if (partitionLookbackDays <= 0) {
            throw new IllegalArgumentException("partitionLookbackDays must be positive: " + partitionLookbackDays);
        }
        Map<String, String> normalized = new TreeMap<>();
        if (partitionedTables != null) {
            partitionedTables.forEach((table, column) -> {
                if (table != null && !table.isBlank() && column != null && !column.isBlank()) {
                    normalized.put(table.trim().toLowerCase(Locale.ROOT), column.trim());
                }
            });
        }
        partitionedTables = Collections.unmodifiableMap(normalized);
    }

    public static SafetyRules defaults() {
        return new SafetyRules(
                DEFAULT_LIMIT,
                DEFAULT_MAX_JOIN_DEPTH,
                DEFAULT_MAX_SUBQUERY_DEPTH,
                DEFAULT_PARTITIONED_TABLES,
                DEFAULT_LOOKBACK_DAYS
        );
    }

    public SafetyRules withLimits(int defaultLimit, int maxJoinDepth, int maxSubqueryDepth) {
        return new SafetyRules(defaultLimit, maxJoinDepth, maxSubqueryDepth, partitionedTables, partitionLookbackDays);
    }

    /** Returns the matched catalog entry for a referenced table name, or {@code null}. */
    Map.Entry<String, String> partitionFor(String referencedTable) {
        if (referencedTable == null || referencedTable.isBlank()) {
            return null;
        }
        String name = referencedTable.toLowerCase(Locale.ROOT);
        String column = partitionedTables.get(name);
        if (column != null) {
            return Map.entry(name, column);
        }
        for (Map.Entry<String, String> entry : partitionedTables.entrySet()) {
            if (name.endsWith("." + entry.getKey())) {
                return entry;
            }
        }
        return null;
    }
}
