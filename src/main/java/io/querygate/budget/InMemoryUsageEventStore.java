package io.querygate.budget;

import io.querygate.model.UsageEvent;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryUsageEventStore implements UsageEventStore {
    private final ConcurrentHashMap<String, Deque<UsageEvent>> byTenant = new ConcurrentHashMap<>();

    @Override
    public void append(UsageEvent event) {
        byTenant.computeIfAbsent(event.tenantId(), k -> new ArrayDeque<>()).addLast(event);
    }

    @Override
    public void pruneThrough(String tenantId, Instant cutoff) {
        Deque<UsageEvent> events = byTenant.get(tenantId);
        if (events == null) {
            return;
        }
        // appended in clock order, so the oldest events sit at the head
        while (!events.isEmpty() && !events.peekFirst().timestamp().isAfter(cutoff)) {
            events.pollFirst();
        }
    }

    @Override
    public List<UsageEvent> events(String tenantId) {
        Deque<UsageEvent> events = byTenant.get(tenantId);
        return events == null ? List.of() : List.copyOf(events);
    }
}
