package io.querygate.executor;

import io.querygate.MutableClock;
import io.querygate.model.PlanStep;
import io.querygate.model.QueryPlan;
import io.querygate.model.StepOutcome;
import io.querygate.model.StepStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class RetryingExecutorTest {
    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");

    @Test
    void transientFailuresAreRetriedUntilSuccess() {
        ScriptedQueryBackend backend = new ScriptedQueryBackend(Map.of(
                "step_1", new ScriptedQueryBackend.Failure(BackendException.TRANSIENT_ERROR, 2)
        ));
        try (RetryingExecutor executor = new RetryingExecutor(backend, RetryPolicy.defaults(), clock)) {
            List<StepOutcome> outcomes = executor.run(plan(PlanStep.query(1, "SELECT dau FROM daily")));

            StepOutcome outcome = outcomes.get(0);
            Assertions.assertEquals(StepStatus.SUCCESS, outcome.status());
            Assertions.assertEquals(2, outcome.retryCount());
            Assertions.assertNull(outcome.error());
            Assertions.assertEquals(ScriptedQueryBackend.DAU_BYTES, outcome.bytesScanned());
            Assertions.assertEquals(3, backend.callCount("step_1"));
        }
    }

    @Test
    void nonRetryableFailureFailsImmediately() {
        ScriptedQueryBackend backend = new ScriptedQueryBackend(Map.of(
                "step_1", new ScriptedQueryBackend.Failure("permission_denied", 1)
        ));
        try (RetryingExecutor executor = new RetryingExecutor(backend, RetryPolicy.defaults(), clock)) {
            StepOutcome outcome = executor.run(plan(PlanStep.query(1, "SELECT 1"))).get(0);

            Assertions.assertEquals(StepStatus.FAILED, outcome.status());
            Assertions.assertEquals(0, outcome.retryCount());
            Assertions.assertEquals("permission_denied", outcome.error());
            Assertions.assertEquals(1, backend.callCount("step_1"));
        }
    }

    @Test
    void retriesStopAtTheBound() {
        ScriptedQueryBackend backend = new ScriptedQueryBackend(Map.of(
                "step_1", new ScriptedQueryBackend.Failure(BackendException.TRANSIENT_ERROR, 10)
        ));
        try (RetryingExecutor executor = new RetryingExecutor(backend, RetryPolicy.defaults().withMaxRetries(2), clock)) {
            StepOutcome outcome = executor.run(plan(PlanStep.query(1, "SELECT 1"))).get(0);

            Assertions.assertEquals(StepStatus.FAILED, outcome.status());
            Assertions.assertEquals(2, outcome.retryCount());
            Assertions.assertEquals(BackendException.TRANSIENT_ERROR, outcome.error());
            Assertions.assertEquals(3, backend.callCount("step_1"));
        }
    }

    @Test
    void stepsAfterAFailureAreSkipped() {
        ScriptedQueryBackend backend = new ScriptedQueryBackend(Map.of(
                "step_1", new ScriptedQueryBackend.Failure("syntax_error", 1)
        ));
        try (RetryingExecutor executor = new RetryingExecutor(backend, RetryPolicy.defaults(), clock)) {
            List<StepOutcome> outcomes = executor.run(plan(PlanStep.query(1, "SELECT 1"), PlanStep.query(2, "SELECT 2")));

            Assertions.assertEquals(2, outcomes.size());
            Assertions.assertEquals(StepStatus.FAILED, outcomes.get(0).status());
            Assertions.assertEquals(StepStatus.SKIPPED, outcomes.get(1).status());
            Assertions.assertNull(outcomes.get(1).outputHash());
            Assertions.assertEquals(0, backend.callCount("step_2"));
        }
    }

    @Test
    void slowCallTimesOutAndIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        QueryBackend slowOnce = (stepName, sql) -> {
            if (calls.getAndIncrement() == 0) {
                try {
                    Thread.sleep(5_000L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new BackendException("interrupted");
                }
            }
            return new QueryResult(List.of(Map.of("ok", 1)), 10L);
        };
        RetryPolicy policy = new RetryPolicy(1, null, Duration.ofMillis(100));
        try (RetryingExecutor executor = new RetryingExecutor(slowOnce, policy, clock)) {
            StepOutcome outcome = executor.run(plan(PlanStep.query(1, "SELECT 1"))).get(0);

            Assertions.assertEquals(StepStatus.SUCCESS, outcome.status());
            Assertions.assertEquals(1, outcome.retryCount());
            Assertions.assertEquals(2, calls.get());
        }
    }

    @Test
    void callThatIgnoresCancellationIsNotRetriedAlongsideItself() {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger ignoredInterrupts = new AtomicInteger();
        QueryBackend stubborn = (stepName, sql) -> {
            calls.incrementAndGet();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (release.getCount() > 0 && System.nanoTime() < deadline) {
                try {
                    release.await(10, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    ignoredInterrupts.incrementAndGet();
                }
            }
            return new QueryResult(List.of(Map.of("ok", 1)), 10L);
        };
        RetryPolicy policy = new RetryPolicy(3, null, Duration.ofMillis(50));
        try (RetryingExecutor executor = new RetryingExecutor(stubborn, policy, clock)) {
            StepOutcome outcome = executor.run(plan(PlanStep.query(1, "SELECT 1"))).get(0);

            Assertions.assertEquals(StepStatus.FAILED, outcome.status());
            Assertions.assertTrue(outcome.error().startsWith(BackendException.TIMEOUT_ABANDONED), outcome.error());
            Assertions.assertEquals(0, outcome.retryCount());
            Assertions.assertEquals(1, calls.get());
            Assertions.assertEquals(1, ignoredInterrupts.get());
        } finally {
            release.countDown();
        }
    }

    @Test
    void unexpectedBackendErrorIsNotRetried() {
        QueryBackend broken = (stepName, sql) -> {
            throw new IllegalStateException("driver exploded");
        };
        try (RetryingExecutor executor = new RetryingExecutor(broken, RetryPolicy.defaults(), clock)) {
            StepOutcome outcome = executor.run(plan(PlanStep.query(1, "SELECT 1"))).get(0);

            Assertions.assertEquals(StepStatus.FAILED, outcome.status());
            Assertions.assertEquals(0, outcome.retryCount());
            Assertions.assertEquals("backend_error: driver exploded", outcome.error());
        }
    }

    @Test
    void missingToolFailsWithoutCallingTheBackend() {
        ScriptedQueryBackend backend = new ScriptedQueryBackend();
        try (RetryingExecutor executor = new RetryingExecutor(backend, RetryPolicy.defaults(), clock)) {
            StepOutcome outcome = executor.execute(new PlanStep(1, null, Map.of("sql", "SELECT 1"), List.of()));

            Assertions.assertEquals(StepStatus.FAILED, outcome.status());
            Assertions.assertEquals("Missing tool in step", outcome.error());
            Assertions.assertEquals(0, backend.callCount("step_1"));
        }
    }

    @Test
    void outputHashIsStableAcrossRunsAndKeyOrder() {
        ScriptedQueryBackend backend = new ScriptedQueryBackend();
        try (RetryingExecutor executor = new RetryingExecutor(backend, RetryPolicy.defaults(), clock)) {
            StepOutcome first = executor.run(plan(PlanStep.query(1, "SELECT dau FROM daily"))).get(0);
            clock.advance(Duration.ofMinutes(5));
            StepOutcome second = executor.run(plan(PlanStep.query(1, "SELECT dau FROM daily"))).get(0);

            Assertions.assertEquals(first.outputHash(), second.outputHash());
            Assertions.assertNotEquals(first.finishedAt(), second.finishedAt());
        }

        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", 2);
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("b", 2);
        ba.put("a", 1);
        Assertions.assertEquals(RetryingExecutor.hashOf(ab), RetryingExecutor.hashOf(ba));
    }

    private static QueryPlan plan(PlanStep... steps) {
        return new QueryPlan("test", List.of(steps));
    }
}
