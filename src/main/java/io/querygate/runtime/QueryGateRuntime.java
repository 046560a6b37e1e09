package io.querygate.runtime;

import io.querygate.budget.BudgetLedger;
import io.querygate.budget.SqliteUsageEventStore;
import io.querygate.config.GateSettings;
import io.querygate.config.QueryGateConfig;
import io.querygate.config.TenantLimits;
import io.querygate.executor.QueryBackend;
import io.querygate.executor.RetryPolicy;
import io.querygate.executor.RetryingExecutor;
import io.querygate.executor.ScriptedQueryBackend;
import io.querygate.gate.CostEstimator;
import io.querygate.gate.PlanValidator;
import io.querygate.gate.PolicyGate;
import io.querygate.idempotency.IdempotentStepCache;
import io.querygate.idempotency.SqliteStepOutcomeStore;
import io.querygate.model.BudgetStatus;
import io.querygate.model.GateDecision;
import io.querygate.model.GateResult;
import io.querygate.model.IdempotencyKey;
import io.querygate.model.PlanStep;
import io.querygate.model.QueryPlan;
import io.querygate.model.SqlVerdict;
import io.querygate.model.StepOutcome;
import io.querygate.observability.AuditLogger;
import io.querygate.observability.PrometheusFormatter;
import io.querygate.storage.CounterStore;
import io.querygate.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class QueryGateRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueryGateRuntime.class);

    public static final String QUERY_RESULT = "query_result";
    public static final String PARTIAL_FAILURE = "partial_failure";
    public static final String BLOCKED = "blocked";
    public static final String ERROR = "error";

    private static final String GATE_DECISIONS = "gate_decisions";
    private static final String DENIALS_BY_NEXT_ACTION = "denials_by_next_action";
    private static final String STEPS_BY_STATUS = "steps_by_status";
    private static final String STEP_RETRIES = "step_retries";
    private static final String RUNS_BY_RESPONSE_TYPE = "runs_by_response_type";
    private static final String IDEMPOTENCY_LOOKUPS = "idempotency_lookups";
    private static final String BYTES_RECORDED = "bytes_recorded";

    private final QueryGateConfig config;
    private final Clock clock;
    private final QueryBackend backend;
    private final Database database;
    private final GateSettings settings;
    private final BudgetLedger ledger;
    private final PolicyGate gate;
    private final PlanValidator validator;
    private final IdempotentStepCache stepCache;
    private final AuditLogger auditLogger;
    private final CounterStore counters;
    private final ConcurrentMap<Integer, RetryingExecutor> executorsByRetryBound;

    public QueryGateRuntime(QueryGateConfig config) {
        this(config, new ScriptedQueryBackend(), Clock.systemUTC());
    }

    public QueryGateRuntime(QueryGateConfig config, QueryBackend backend, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.database = new Database(config);
        this.settings = GateSettings.load(config.settingsFile());
        this.ledger = new BudgetLedger(new SqliteUsageEventStore(database), settings, clock);
        this.gate = new PolicyGate(settings.baseSafetyRules(), settings, ledger, new CostEstimator(settings.pricePerTibUsd()));
        this.validator = new PlanValidator();
        this.stepCache = new IdempotentStepCache(new SqliteStepOutcomeStore(database), clock);
        this.auditLogger = new AuditLogger(
                config.auditLogFile(),
                loadOrCreateAuditSigningSecret(config.auditSigningKeyFile()),
                clock
        );
        this.counters = new CounterStore(database);
        this.executorsByRetryBound = new ConcurrentHashMap<>();
    }

    public void init() {
        database.init();
        // outcomes past the TTL are never replayed
        int purged = stepCache.purgeOlderThan(Duration.ofDays(settings.idempotencyTtlDays()));
        log.info("QueryGate runtime initialized root={} purgedIdempotentSteps={}", config.rootDir(), purged);
    }

    public GateSettings settings() {
        return settings;
    }

    public SqlVerdict evaluateSql(String tenantId, String sql) {
        TenantLimits limits = settings.limitsFor(tenantId);
        return gate.analyzerFor(limits).evaluate(sql);
    }

    /** Gates the plan without executing it. Budget is checked, never consumed. */
    public GateResult preview(String tenantId, QueryPlan plan) {
        List<String> errors = validator.validate(plan);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid plan: " + String.join("; ", errors));
        }
        GateResult result = gate.preExecute(tenantId, plan);
        auditDecision("gate.preview", tenantId, null, result);
        return result;
    }

    public RunOutcome run(String tenantId, String workflowId, QueryPlan plan) {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(workflowId, "workflowId");
        List<String> errors = validator.validate(plan);
        if (!errors.isEmpty()) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "plan.invalid", tenantId, workflowId, null, "rejected", Map.of("errors", errors)
            ));
            return finish(new RunOutcome(ERROR, "Invalid plan: " + String.join("; ", errors), Map.of(),
                    List.of(), null, List.of(), List.of()));
        }

        GateResult gated = gate.preExecute(tenantId, plan);
        countDecision(gated.decision());
        auditDecision("gate.decision", tenantId, workflowId, gated);
        if (!gated.allowed()) {
            String summary = "Blocked: " + String.join("; ", gated.reasons());
            return finish(new RunOutcome(BLOCKED, summary, Map.of(), List.of(), gated.decision(), List.of(), List.of()));
        }

        TenantLimits limits = settings.limitsFor(tenantId);
        List<String> replayed = new ArrayList<>();
        List<StepOutcome> outcomes = executorFor(limits).run(gated.plan(), (step, execution) -> {
            IdempotencyKey key = IdempotentStepCache.key(tenantId, workflowId, step.name(), step.inputs());
            IdempotentStepCache.Resolution resolution = stepCache.getOrExecute(key, execution);
            StepOutcome outcome = resolution.outcome();
            counters.increment(IDEMPOTENCY_LOOKUPS, resolution.replayed() ? "hit" : "miss", 1L);
            if (resolution.replayed()) {
                replayed.add(step.name());
            } else if (outcome.succeeded()) {
                ledger.record(tenantId, outcome.bytesScanned());
                counters.increment(BYTES_RECORDED, outcome.bytesScanned());
            }
            auditStep(tenantId, workflowId, step, outcome, resolution.replayed());
            return outcome;
        });

        List<String> warnings = new ArrayList<>();
        for (StepOutcome outcome : outcomes) {
            counters.increment(STEPS_BY_STATUS, outcome.status().wireName(), 1L);
            counters.increment(STEP_RETRIES, outcome.retryCount());
            if (outcome.succeeded()) {
                warnings.addAll(gate.postExecute(tenantId, outcome.output()));
            }
        }
        return finish(compose(outcomes, warnings, gated.decision(), replayed));
    }

    public BudgetStatus checkBudget(String tenantId, long estimatedBytes) {
        return ledger.check(tenantId, estimatedBytes);
    }

    public BudgetStatus recordUsage(String tenantId, long bytes) {
        ledger.record(tenantId, bytes);
        counters.increment(BYTES_RECORDED, bytes);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "budget.record", tenantId, null, null, "ok", Map.of("bytes", bytes)
        ));
        return ledger.usage(tenantId);
    }

    /** Totals for the data root, including runs made by earlier processes. */
    public StatsOutcome stats() {
        return new StatsOutcome(
                counters.value(GATE_DECISIONS, "allowed"),
                counters.value(GATE_DECISIONS, "denied"),
                counters.value(GATE_DECISIONS, "approval_required"),
                counters.byLabel(DENIALS_BY_NEXT_ACTION),
                counters.byLabel(STEPS_BY_STATUS),
                counters.value(STEP_RETRIES),
                counters.byLabel(RUNS_BY_RESPONSE_TYPE),
                counters.value(IDEMPOTENCY_LOOKUPS, "hit"),
                counters.value(IDEMPOTENCY_LOOKUPS, "miss"),
                stepCache.size(),
                counters.value(BYTES_RECORDED)
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    public List<Map<String, Object>> auditTail(int limit) {
        return auditLogger.tail(limit);
    }

    public AuditLogger.VerifyResult verifyAuditIntegrity() {
        return auditLogger.verify();
    }

    public int purgeIdempotency(int ttlDays) {
        if (ttlDays < 0) {
            throw new IllegalArgumentException("ttlDays must be non-negative: " + ttlDays);
        }
        int purged = stepCache.purgeOlderThan(Duration.ofDays(ttlDays));
        auditLogger.log(AuditLogger.AuditEvent.of(
                "idempotency.purge", null, null, null, "ok", Map.of("ttl_days", ttlDays, "purged", purged)
        ));
        return purged;
    }

    @Override
    public void close() {
        for (RetryingExecutor executor : executorsByRetryBound.values()) {
            executor.close();
        }
        executorsByRetryBound.clear();
    }

    private RetryingExecutor executorFor(TenantLimits limits) {
        return executorsByRetryBound.computeIfAbsent(limits.maxRetries(), bound -> new RetryingExecutor(
                backend,
                new RetryPolicy(bound, settings.retryableSignals(), Duration.ofMillis(settings.callTimeoutMs())),
                clock
        ));
    }

    private static RunOutcome compose(
            List<StepOutcome> outcomes,
            List<String> warnings,
            GateDecision decision,
            List<String> replayed
    ) {
        if (outcomes.isEmpty()) {
            return new RunOutcome(ERROR, "No steps executed", Map.of(), warnings, decision, outcomes, replayed);
        }
        for (StepOutcome outcome : outcomes) {
            if (!outcome.succeeded()) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("step", outcome.stepName());
                data.put("retry_count", outcome.retryCount());
                return new RunOutcome(PARTIAL_FAILURE, "Step failed: " + outcome.error(), data, warnings,
                        decision, outcomes, replayed);
            }
        }
        return new RunOutcome(QUERY_RESULT, "Query completed", outcomes.get(0).output(), warnings,
                decision, outcomes, replayed);
    }

    private RunOutcome finish(RunOutcome outcome) {
        counters.increment(RUNS_BY_RESPONSE_TYPE, outcome.responseType(), 1L);
        return outcome;
    }

    private void countDecision(GateDecision decision) {
        counters.increment(GATE_DECISIONS, verdictOf(decision), 1L);
        if (!decision.allowed()) {
            counters.increment(DENIALS_BY_NEXT_ACTION, decision.nextAction().wireName(), 1L);
        }
    }

    private static String verdictOf(GateDecision decision) {
        return decision.allowed() ? "allowed" : decision.approvalRequired() ? "approval_required" : "denied";
    }

    private void auditDecision(String action, String tenantId, String workflowId, GateResult result) {
        GateDecision decision = result.decision();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reasons", decision.reasons());
        details.put("approval_required", decision.approvalRequired());
        details.put("next_action", decision.nextAction().wireName());
        details.put("estimated_bytes", decision.estimatedBytes());
        details.put("estimated_cost_usd", decision.estimatedCostUsd());
        List<String> sql = new ArrayList<>();
        for (PlanStep step : result.plan().steps()) {
            if (step.sql() != null) {
                sql.add(step.sql());
            }
        }
        details.put("sql", sql);
        auditLogger.log(AuditLogger.AuditEvent.of(action, tenantId, workflowId, null, verdictOf(decision), details));
    }

    private void auditStep(String tenantId, String workflowId, PlanStep step, StepOutcome outcome, boolean replayed) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("replayed", replayed);
        details.put("retry_count", outcome.retryCount());
        details.put("bytes_scanned", outcome.bytesScanned());
        details.put("output_hash", outcome.outputHash());
        if (outcome.error() != null) {
            details.put("error", outcome.error());
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "step.outcome", tenantId, workflowId, step.name(), outcome.status().wireName(), details
        ));
    }

    private static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    public record RunOutcome(
            String responseType,
            String summary,
            Map<String, Object> data,
            List<String> warnings,
            GateDecision decision,
            List<StepOutcome> outcomes,
            List<String> replayedSteps
    ) {
        public RunOutcome {
            data = data == null ? Map.of() : data;
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
            outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
            replayedSteps = replayedSteps == null ? List.of() : List.copyOf(replayedSteps);
        }
    }

    public record StatsOutcome(
            long gateAllowed,
            long gateDenied,
            long gateApprovalRequired,
            Map<String, Long> denialsByNextAction,
            Map<String, Long> stepsByStatus,
            long retries,
            Map<String, Long> runsByResponseType,
            long idempotencyHits,
            long idempotencyMisses,
            long idempotencyEntries,
            long bytesRecorded
    ) {
    }
}
