package io.querygate.config;

import io.querygate.safety.SafetyRules;

/**
 * Per-tenant caps. Byte values are raw bytes; the soft cap triggers an approval request, the hard
 * cap a plain denial.
 */
public record TenantLimits(
        long hourlyBudgetBytes,
        long perQuerySoftCapBytes,
        long perQueryHardCapBytes,
        int maxRetries,
        int defaultLimit,
        int maxJoinDepth,
        int maxSubqueryDepth
) {
    public static final long GIB = 1024L * 1024L * 1024L;
    public static final long DEFAULT_HOURLY_BUDGET_BYTES = 50L * GIB;
    public static final long DEFAULT_SOFT_CAP_BYTES = 10L * GIB;
    public static final long DEFAULT_HARD_CAP_BYTES = 100L * GIB;
    public static final int DEFAULT_MAX_RETRIES = 3;

    public TenantLimits {
        if (hourlyBudgetBytes <= 0L) {
            throw new IllegalArgumentException("hourlyBudgetBytes must be positive: " + hourlyBudgetBytes);
        }
        if (perQuerySoftCapBytes <= 0L || perQueryHardCapBytes <= 0L) {
            throw new IllegalArgumentException("per-query caps must be positive");
        }
        if (perQuerySoftCapBytes > perQueryHardCapBytes) {
            throw new IllegalArgumentException(
                    "soft cap " + perQuerySoftCapBytes + " exceeds hard cap " + perQueryHardCapBytes
            );
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative: " + maxRetries);
        }
        if (defaultLimit <= 0) {
            throw new IllegalArgumentException("defaultLimit must be positive: " + defaultLimit);
        }
    }

    public static TenantLimits defaults() {
        return new TenantLimits(
                DEFAULT_HOURLY_BUDGET_BYTES,
                DEFAULT_SOFT_CAP_BYTES,
                DEFAULT_HARD_CAP_BYTES,
                DEFAULT_MAX_RETRIES,
                SafetyRules.DEFAULT_LIMIT,
                SafetyRules.DEFAULT_MAX_JOIN_DEPTH,
                SafetyRules.DEFAULT_MAX_SUBQUERY_DEPTH
        );
    }

    public SafetyRules applyTo(SafetyRules base) {
        return base.withLimits(defaultLimit, maxJoinDepth, maxSubqueryDepth);
    }
}
