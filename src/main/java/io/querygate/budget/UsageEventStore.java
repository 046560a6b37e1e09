package io.querygate.budget;

import io.querygate.model.UsageEvent;

import java.time.Instant;
import java.util.List;

/**
 * Ordered per-tenant usage history. Callers serialize access per tenant; implementations only need
 * to be safe for concurrent use across different tenants.
 */
public interface UsageEventStore {
    void append(UsageEvent event);

    /** Drops events of the tenant with a timestamp at or before {@code cutoff}. */
    void pruneThrough(String tenantId, Instant cutoff);

    List<UsageEvent> events(String tenantId);
}
