package io.querygate.gate;

/**
 * Heuristic scan estimate from SQL text length, used to rank queries
 * against the per-query caps and the hourly budget.
 */
public final class CostEstimator {
    public static final long BYTES_PER_SQL_CHAR = 2048L;
    private static final double BYTES_PER_TIB = 1024.0 * 1024.0 * 1024.0 * 1024.0;

    private final double pricePerTibUsd;

    public CostEstimator(double pricePerTibUsd) {
        if (pricePerTibUsd < 0.0 || Double.isNaN(pricePerTibUsd)) {
            throw new IllegalArgumentException("pricePerTibUsd must be non-negative: " + pricePerTibUsd);
        }
        this.pricePerTibUsd = pricePerTibUsd;
    }

    /** Capped at {@code hardCapBytes + 1} so an oversized query still reads as "over the hard cap". */
    public long estimateBytes(String sql, long hardCapBytes) {
        long length = sql == null ? 0L : sql.length();
        long ceiling = hardCapBytes == Long.MAX_VALUE ? Long.MAX_VALUE : hardCapBytes + 1L;
        if (length > ceiling / BYTES_PER_SQL_CHAR) {
            return ceiling;
        }
        return Math.min(length * BYTES_PER_SQL_CHAR, ceiling);
    }

    public double costUsd(long bytes) {
        double raw = bytes / BYTES_PER_TIB * pricePerTibUsd;
        return Math.round(raw * 10_000.0) / 10_000.0;
    }
}
