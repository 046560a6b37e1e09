package io.querygate.model;

public record BudgetStatus(
        boolean allowed,
        long bytesUsed,
        long bytesRemaining,
        long budget,
        String suggestion
) {
    public BudgetStatus {
        if (budget <= 0L) {
            throw new IllegalArgumentException("budget must be positive: " + budget);
        }
        if (bytesUsed < 0L || bytesRemaining < 0L) {
            throw new IllegalArgumentException("byte counters must be non-negative");
        }
    }
}
