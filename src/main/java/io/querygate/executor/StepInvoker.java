package io.querygate.executor;

import io.querygate.model.PlanStep;
import io.querygate.model.StepOutcome;

import java.util.function.Supplier;

/** Wraps the execution of one step, for example to serve it from a cache. */
@FunctionalInterface
public interface StepInvoker {
    StepInvoker DIRECT = (step, execution) -> execution.get();

    StepOutcome invoke(PlanStep step, Supplier<StepOutcome> execution);
}
