package io.querygate.model;

import java.util.ArrayList;
import java.util.List;

public record QueryPlan(String goal, List<PlanStep> steps) {
    public QueryPlan {
        goal = goal == null ? "" : goal;
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public QueryPlan withStep(int index, PlanStep step) {
        List<PlanStep> copy = new ArrayList<>(steps);
        copy.set(index, step);
        return new QueryPlan(goal, copy);
    }
}
