package io.querygate.executor;

import io.querygate.model.PlanStep;
import io.querygate.model.QueryPlan;
import io.querygate.model.StepOutcome;
import io.querygate.model.StepStatus;
import io.querygate.util.Hashing;
import io.querygate.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs plan steps one after another. Each backend call gets its own deadline; a call that misses
 * it is cancelled and counts as a {@code timeout} failure. The first failed step halts the plan and
 * the steps after it are reported as skipped.
 *
 * <p>Attempts of one step never overlap. After cancelling a timed-out call the executor waits up to
 * one call timeout for it to stop; a backend that ignores interruption past that point fails the
 * step with {@code timeout_abandoned} instead of being retried. Its pool thread stays busy until the
 * backend returns.
 */
public final class RetryingExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetryingExecutor.class);
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final QueryBackend backend;
    private final RetryPolicy policy;
    private final Clock clock;
    private final ExecutorService callPool;
    private final Duration cancelGrace;

    public RetryingExecutor(QueryBackend backend, RetryPolicy policy, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.callPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "querygate-backend-" + THREAD_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.cancelGrace = policy.callTimeout();
    }

    public RetryPolicy policy() {
        return policy;
    }

    public List<StepOutcome> run(QueryPlan plan) {
        return run(plan, StepInvoker.DIRECT);
    }

    public List<StepOutcome> run(QueryPlan plan, StepInvoker invoker) {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(invoker, "invoker");
        List<StepOutcome> outcomes = new ArrayList<>(plan.steps().size());
        boolean halted = false;
        for (PlanStep step : plan.steps()) {
            if (halted) {
                outcomes.add(skipped(step));
                continue;
            }
            StepOutcome outcome = invoker.invoke(step, () -> execute(step));
            outcomes.add(outcome);
            if (!outcome.succeeded()) {
                log.warn("Step failed, halting plan step={} retries={} error={}",
                        outcome.stepName(), outcome.retryCount(), outcome.error());
                halted = true;
            }
        }
        return outcomes;
    }

    /** Executes one step with retries, without halting semantics or an invoker. */
    public StepOutcome execute(PlanStep step) {
        Instant startedAt = clock.instant();
        if (step.tool() == null) {
            return new StepOutcome(step.name(), null, StepStatus.FAILED, Map.of(), hashOf(Map.of()),
                    startedAt, clock.instant(), 0, "Missing tool in step");
        }
        RetryState state = new RetryState(policy);
        while (true) {
            try {
                QueryResult result = dispatch(step);
                state.succeeded();
                Map<String, Object> output = result.toOutput();
                return new StepOutcome(step.name(), step.tool(), StepStatus.SUCCESS, output, hashOf(output),
                        startedAt, clock.instant(), state.retries(), null);
            } catch (BackendException e) {
                if (state.failed(e)) {
                    log.debug("Retrying step={} signal={} retry={}", step.name(), e.signal(), state.retries());
                    continue;
                }
                return new StepOutcome(step.name(), step.tool(), StepStatus.FAILED, Map.of(), hashOf(Map.of()),
                        startedAt, clock.instant(), state.retries(), state.lastError());
            }
        }
    }

    private QueryResult dispatch(PlanStep step) {
        return switch (step.tool()) {
            case EXECUTE_QUERY -> call(step.name(), step.sql());
        };
    }

    private QueryResult call(String stepName, String sql) {
        CountDownLatch finished = new CountDownLatch(1);
        Future<QueryResult> future = callPool.submit(() -> {
            try {
                return backend.execute(stepName, sql);
            } finally {
                finished.countDown();
            }
        });
        try {
            QueryResult result = future.get(policy.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new BackendException("backend_error", "backend returned no result", null);
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            awaitStopped(stepName, finished);
            throw new BackendException(BackendException.TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BackendException backendError) {
                throw backendError;
            }
            throw new BackendException("backend_error", cause == null ? null : cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackendException("interrupted", "interrupted while waiting for backend", e);
        }
    }

    private void awaitStopped(String stepName, CountDownLatch finished) {
        boolean stopped;
        try {
            stopped = finished.await(cancelGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("interrupted", "interrupted while waiting for backend", e);
        }
        if (!stopped) {
            log.warn("Cancelled backend call still running step={} grace={}ms", stepName, cancelGrace.toMillis());
            throw new BackendException(BackendException.TIMEOUT_ABANDONED,
                    "backend ignored cancellation for " + cancelGrace.toMillis() + "ms", null);
        }
    }

    private StepOutcome skipped(PlanStep step) {
        Instant now = clock.instant();
        return new StepOutcome(step.name(), step.tool(), StepStatus.SKIPPED, Map.of(), null, now, now, 0, null);
    }

    static String hashOf(Map<String, Object> output) {
        return Hashing.sha256Hex(Jsons.canonical(output));
    }

    @Override
    public void close() {
        callPool.shutdownNow();
    }
}
