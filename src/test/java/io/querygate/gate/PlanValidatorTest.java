package io.querygate.gate;

import io.querygate.model.PlanStep;
import io.querygate.model.QueryPlan;
import io.querygate.model.Tool;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class PlanValidatorTest {
    private final PlanValidator validator = new PlanValidator();

    @Test
    void wellFormedPlanHasNoErrors() {
        QueryPlan plan = new QueryPlan("dau", List.of(PlanStep.query(1, "SELECT 1"), PlanStep.query(2, "SELECT 2")));
        Assertions.assertTrue(validator.validate(plan).isEmpty());
    }

    @Test
    void structuralProblemsAreReported() {
        Assertions.assertEquals(List.of("Plan is missing"), validator.validate(null));
        Assertions.assertEquals(List.of("Plan has no steps"), validator.validate(new QueryPlan("x", List.of())));

        QueryPlan plan = new QueryPlan("x", List.of(
                new PlanStep(1, null, Map.of(), List.of()),
                new PlanStep(2, Tool.EXECUTE_QUERY, Map.of(), List.of()),
                PlanStep.query(2, "SELECT 1")
        ));
        Assertions.assertEquals(
                List.of("Missing tool in step", "execute_query missing sql", "Duplicate step id 2"),
                validator.validate(plan)
        );
    }
}
