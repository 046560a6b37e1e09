package io.querygate.budget;

import io.querygate.config.TenantLimitsProvider;
import io.querygate.model.BudgetStatus;
import io.querygate.model.UsageEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding one-hour byte budget per tenant.
 *
 * <p>Every operation for a tenant runs under that tenant's lock, so a check and the prune it does
 * never interleave with a concurrent record. Tenants never share a lock.
 */
public final class BudgetLedger {
    private static final Logger log = LoggerFactory.getLogger(BudgetLedger.class);

    public static final Duration WINDOW = Duration.ofHours(1);
    public static final String OVER_BUDGET_SUGGESTION = "Try sampling or a narrower time range";

    private final UsageEventStore store;
    private final TenantLimitsProvider limits;
    private final Clock clock;
    private final ConcurrentHashMap<String, Object> tenantLocks = new ConcurrentHashMap<>();

    public BudgetLedger(UsageEventStore store, TenantLimitsProvider limits, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BudgetStatus check(String tenantId, long estimatedBytes) {
        requireTenant(tenantId);
        if (estimatedBytes < 0L) {
            throw new IllegalArgumentException("estimatedBytes must be non-negative: " + estimatedBytes);
        }
        long budget = limits.limitsFor(tenantId).hourlyBudgetBytes();
        synchronized (lockFor(tenantId)) {
            long used = windowUsage(tenantId);
            long projected = used + estimatedBytes;
            if (projected > budget) {
                log.debug("Budget denied tenant={} used={} estimate={} budget={}", tenantId, used, estimatedBytes, budget);
                return new BudgetStatus(false, used, Math.max(0L, budget - used), budget, OVER_BUDGET_SUGGESTION);
            }
            return new BudgetStatus(true, projected, budget - projected, budget, null);
        }
    }

    public void record(String tenantId, long actualBytes) {
        requireTenant(tenantId);
        if (actualBytes < 0L) {
            throw new IllegalArgumentException("actualBytes must be non-negative: " + actualBytes);
        }
        synchronized (lockFor(tenantId)) {
            store.append(new UsageEvent(tenantId, clock.instant(), actualBytes));
        }
    }

    /** Bytes used by the tenant inside the current window, with no estimate applied. */
    public BudgetStatus usage(String tenantId) {
        return check(tenantId, 0L);
    }

    private long windowUsage(String tenantId) {
        Instant cutoff = clock.instant().minus(WINDOW);
        store.pruneThrough(tenantId, cutoff);
        long used = 0L;
        for (UsageEvent event : store.events(tenantId)) {
            if (event.timestamp().isAfter(cutoff)) {
                used += event.bytes();
            }
        }
        return used;
    }

    private Object lockFor(String tenantId) {
        return tenantLocks.computeIfAbsent(tenantId, k -> new Object());
    }

    private static void requireTenant(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId");
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be blank");
        }
    }
}
