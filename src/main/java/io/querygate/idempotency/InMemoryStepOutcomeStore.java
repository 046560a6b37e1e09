package io.querygate.idempotency;

import io.querygate.model.IdempotencyKey;
import io.querygate.model.StepOutcome;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryStepOutcomeStore implements StepOutcomeStore {
    private final ConcurrentHashMap<IdempotencyKey, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<StepOutcome> find(IdempotencyKey key) {
        Entry entry = entries.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.outcome());
    }

    @Override
    public boolean saveIfAbsent(IdempotencyKey key, StepOutcome outcome, Instant storedAt) {
        return entries.putIfAbsent(key, new Entry(outcome, storedAt)) == null;
    }

    @Override
    public int purgeStoredBefore(Instant cutoff) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.storedAt().isBefore(cutoff));
        return Math.max(0, before - entries.size());
    }

    @Override
    public long count() {
        return entries.size();
    }

    private record Entry(StepOutcome outcome, Instant storedAt) {
    }
}
