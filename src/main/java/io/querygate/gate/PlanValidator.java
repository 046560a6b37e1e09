package io.querygate.gate;

import io.querygate.model.PlanStep;
import io.querygate.model.QueryPlan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Structural checks run before a plan reaches the gate. */
public final class PlanValidator {

    public List<String> validate(QueryPlan plan) {
        List<String> errors = new ArrayList<>();
        if (plan == null) {
            errors.add("Plan is missing");
            return errors;
        }
        if (plan.steps().isEmpty()) {
            errors.add("Plan has no steps");
        }
        Set<Integer> seen = new HashSet<>();
        for (PlanStep step : plan.steps()) {
            if (step == null || step.tool() == null) {
                errors.add("Missing tool in step");
                continue;
            }
            if (!seen.add(step.stepId())) {
                errors.add("Duplicate step id " + step.stepId());
            }
            switch (step.tool()) {
                case EXECUTE_QUERY -> {
                    String sql = step.sql();
                    if (sql == null || sql.isBlank()) {
                        errors.add(step.tool().wireName() + " missing sql");
                    }
                }
            }
        }
        return errors;
    }
}
