package io.querygate.executor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic in-process backend. A failure schedule makes a step fail with a given signal for
 * its first N calls; afterwards it answers with canned rows.
 */
public final class ScriptedQueryBackend implements QueryBackend {
    public static final long DAU_BYTES = 1024L * 1024L;
    public static final long HEALTH_CHECK_BYTES = 1024L;

    private final Map<String, Failure> schedule;
    private final ConcurrentHashMap<String, AtomicInteger> calls = new ConcurrentHashMap<>();

    public ScriptedQueryBackend() {
        this(Map.of());
    }

    public ScriptedQueryBackend(Map<String, Failure> schedule) {
        this.schedule = schedule == null ? Map.of() : Map.copyOf(schedule);
    }

    @Override
    public QueryResult execute(String stepName, String sql) {
        int n = calls.computeIfAbsent(stepName, k -> new AtomicInteger()).getAndIncrement();
        Failure failure = schedule.get(stepName);
        if (failure != null && n < failure.failCount()) {
            throw new BackendException(failure.signal());
        }
        if (sql != null && sql.toLowerCase(Locale.ROOT).contains("dau")) {
            return new QueryResult(List.of(
                    row("day", "2026-02-13", "dau", 12_000),
                    row("day", "2026-02-14", "dau", 12_450)
            ), DAU_BYTES);
        }
        return new QueryResult(List.of(row("health_check", 1)), HEALTH_CHECK_BYTES);
    }

    public int callCount(String stepName) {
        AtomicInteger count = calls.get(stepName);
        return count == null ? 0 : count.get();
    }

    private static Map<String, Object> row(Object... pairs) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            out.put(pairs[i].toString(), pairs[i + 1]);
        }
        return out;
    }

    public record Failure(String signal, int failCount) {
        public Failure {
            if (failCount < 0) {
                throw new IllegalArgumentException("failCount must be non-negative: " + failCount);
            }
        }
    }
}
