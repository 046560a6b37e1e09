package io.querygate.gate;

import io.querygate.budget.BudgetLedger;
import io.querygate.config.TenantLimits;
import io.querygate.config.TenantLimitsProvider;
import io.querygate.model.BudgetStatus;
import io.querygate.model.GateDecision;
import io.querygate.model.GateResult;
import io.querygate.model.NextAction;
import io.querygate.model.PlanStep;
import io.querygate.model.QueryPlan;
import io.querygate.model.SqlVerdict;
import io.querygate.safety.SafetyRules;
import io.querygate.safety.SqlSafetyAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a plan may run. SQL-bearing steps are checked in order and the first blocking step
 * halts evaluation; allowed steps come back rewritten and annotated with their byte estimate.
 */
public final class PolicyGate {
    private static final Logger log = LoggerFactory.getLogger(PolicyGate.class);

    static final String HARD_CAP_REASON = "Query exceeds hard max bytes with approval";
    static final String SOFT_CAP_REASON = "Query exceeds per-query limit and requires approval";
    static final String BUDGET_REASON = "Hourly budget exceeded";

    private final SafetyRules baseRules;
    private final TenantLimitsProvider limits;
    private final BudgetLedger ledger;
    private final CostEstimator estimator;
    private final ConcurrentHashMap<SafetyRules, SqlSafetyAnalyzer> analyzers = new ConcurrentHashMap<>();

    public PolicyGate(SafetyRules baseRules, TenantLimitsProvider limits, BudgetLedger ledger, CostEstimator estimator) {
        this.baseRules = Objects.requireNonNull(baseRules, "baseRules");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.estimator = Objects.requireNonNull(estimator, "estimator");
    }

    public GateResult preExecute(String tenantId, QueryPlan plan) {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(plan, "plan");
        TenantLimits tenantLimits = limits.limitsFor(tenantId);
        SqlSafetyAnalyzer analyzer = analyzerFor(tenantLimits);

        QueryPlan current = plan;
        long planBytes = 0L;
        for (int i = 0; i < current.steps().size(); i++) {
            PlanStep step = current.steps().get(i);
            if (step.tool() == null || !step.tool().sqlBearing()) {
                continue;
            }
            SqlVerdict verdict = analyzer.evaluate(step.sql());
            if (!verdict.allowed()) {
                log.info("Gate blocked tenant={} step={} reasons={}", tenantId, step.name(), verdict.reasons());
                return GateResult.of(current, GateDecision.deny(verdict.reasons(), NextAction.REVISE_QUERY, 0L, 0.0));
            }
            if (verdict.hasRewrite()) {
                step = step.withInput(PlanStep.SQL_INPUT, verdict.rewrittenSql());
                current = current.withStep(i, step);
            }

            long estimate = estimator.estimateBytes(step.sql(), tenantLimits.perQueryHardCapBytes());
            double cost = estimator.costUsd(estimate);
            if (estimate > tenantLimits.perQueryHardCapBytes()) {
                return GateResult.of(current, GateDecision.deny(List.of(HARD_CAP_REASON), NextAction.NARROW_SCOPE, estimate, cost));
            }
            if (estimate > tenantLimits.perQuerySoftCapBytes()) {
                return GateResult.of(current, GateDecision.approvalRequired(List.of(SOFT_CAP_REASON), estimate, cost));
            }

            BudgetStatus budget = ledger.check(tenantId, planBytes + estimate);
            if (!budget.allowed()) {
                log.info("Gate over budget tenant={} step={} used={} budget={}",
                        tenantId, step.name(), budget.bytesUsed(), budget.budget());
                return GateResult.of(current, GateDecision.deny(List.of(BUDGET_REASON), NextAction.WAIT_OR_REDUCE_COST, estimate, cost));
            }
            planBytes += estimate;
            current = current.withStep(i, step.withInput(PlanStep.ESTIMATED_BYTES_INPUT, estimate));
        }
        return GateResult.of(current, GateDecision.allow(planBytes, estimator.costUsd(planBytes)));
    }

    public List<String> postExecute(Map<String, Object> output) {
        return postExecute(null, output);
    }

    /** Non-blocking observations about a step's output. */
    public List<String> postExecute(String tenantId, Map<String, Object> output) {
        List<String> warnings = new ArrayList<>();
        if (output == null) {
            return warnings;
        }
        Object rows = output.get("rows");
        if (rows instanceof List<?> list) {
            if (list.isEmpty()) {
                warnings.add("No data returned");
            } else {
                int rowLimit = limits.limitsFor(tenantId).defaultLimit();
                if (list.size() >= rowLimit) {
                    warnings.add("Result may be truncated at the row limit (" + rowLimit + ")");
                }
            }
        }
        return warnings;
    }

    public SqlSafetyAnalyzer analyzerFor(TenantLimits tenantLimits) {
        SafetyRules rules = tenantLimits.applyTo(baseRules);
        return analyzers.computeIfAbsent(rules, SqlSafetyAnalyzer::new);
    }
}
