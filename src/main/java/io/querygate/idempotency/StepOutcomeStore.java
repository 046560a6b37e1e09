package io.querygate.idempotency;

import io.querygate.model.IdempotencyKey;
import io.querygate.model.StepOutcome;

import java.time.Instant;
import java.util.Optional;

public interface StepOutcomeStore {
    Optional<StepOutcome> find(IdempotencyKey key);

    /** Stores the outcome unless the key is already present; returns true when it was stored. */
    boolean saveIfAbsent(IdempotencyKey key, StepOutcome outcome, Instant storedAt);

    int purgeStoredBefore(Instant cutoff);

    long count();
}
