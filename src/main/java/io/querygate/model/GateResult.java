package io.querygate.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a pre-execution gate pass: the verdict, its reasons, the plan as it should run (with
 * rewritten SQL and attached estimates), and the decision details for self-remediation.
 */
public record GateResult(boolean allowed, List<String> reasons, QueryPlan plan, GateDecision decision) {
    public GateResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(decision, "decision");
    }

    public static GateResult of(QueryPlan plan, GateDecision decision) {
        return new GateResult(decision.allowed(), decision.reasons(), plan, decision);
    }
}
