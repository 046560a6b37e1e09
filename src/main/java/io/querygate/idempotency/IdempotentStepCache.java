package io.querygate.idempotency;

import io.querygate.model.IdempotencyKey;
import io.querygate.model.StepOutcome;
import io.querygate.util.Hashing;
import io.querygate.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Content-addressed store of step outcomes. Keys are derived from the tenant, workflow, step name and
 * payload, so the same step of the same workflow with the same inputs replays its recorded outcome.
 *
 * <p>{@link #getOrExecute} allows one execution in flight per key: concurrent callers with the key
 * wait for that execution and share its outcome. Only successful outcomes are kept.
 */
public final class IdempotentStepCache {
    private static final Logger log = LoggerFactory.getLogger(IdempotentStepCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofDays(7);

    private final StepOutcomeStore store;
    private final Clock clock;
    private final ConcurrentHashMap<IdempotencyKey, CompletableFuture<StepOutcome>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public IdempotentStepCache(StepOutcomeStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static IdempotencyKey key(String tenantId, String workflowId, String stepName, Object payload) {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(stepName, "stepName");
        String canonical = Jsons.canonical(Arrays.asList(tenantId, workflowId, stepName, payload));
        return new IdempotencyKey(Hashing.sha256Hex(canonical));
    }

    public Optional<StepOutcome> get(IdempotencyKey key) {
        return store.find(Objects.requireNonNull(key, "key"));
    }

    /** Stores the outcome if the key is still free. Existing entries are never overwritten. */
    public boolean put(IdempotencyKey key, StepOutcome outcome) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(outcome, "outcome");
        return store.saveIfAbsent(key, outcome, clock.instant());
    }

    public Resolution getOrExecute(IdempotencyKey key, Supplier<StepOutcome> execution) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(execution, "execution");
        Optional<StepOutcome> cached = store.find(key);
        if (cached.isPresent()) {
            hits.incrementAndGet();
            return new Resolution(cached.get(), true);
        }

        CompletableFuture<StepOutcome> created = new CompletableFuture<>();
        CompletableFuture<StepOutcome> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            hits.incrementAndGet();
            return new Resolution(await(existing), true);
        }

        try {
            // a concurrent leader may have finished between the lookup and the registration
            Optional<StepOutcome> raced = store.find(key);
            if (raced.isPresent()) {
                hits.incrementAndGet();
                created.complete(raced.get());
                return new Resolution(raced.get(), true);
            }
            misses.incrementAndGet();
            StepOutcome outcome = execution.get();
            if (outcome.succeeded()) {
                put(key, outcome);
            } else {
                log.debug("Not caching unsuccessful outcome key={} status={}", key, outcome.status());
            }
            created.complete(outcome);
            return new Resolution(outcome, false);
        } catch (RuntimeException | Error e) {
            created.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, created);
        }
    }

    public int purgeOlderThan(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be non-negative: " + ttl);
        }
        int purged = store.purgeStoredBefore(clock.instant().minus(ttl));
        if (purged > 0) {
            log.info("Purged {} idempotent step outcomes older than {}", purged, ttl);
        }
        return purged;
    }

    public long size() {
        return store.count();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    private static StepOutcome await(CompletableFuture<StepOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        }
    }

    /** Outcome of a lookup-or-execute; {@code replayed} is true when this caller did not execute. */
    public record Resolution(StepOutcome outcome, boolean replayed) {
    }
}
