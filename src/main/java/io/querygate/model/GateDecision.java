package io.querygate.model;

import java.util.List;
import java.util.Objects;

public record GateDecision(
        boolean allowed,
        List<String> reasons,
        boolean approvalRequired,
        NextAction nextAction,
        long estimatedBytes,
        double estimatedCostUsd
) {
    public GateDecision {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        nextAction = Objects.requireNonNullElse(nextAction, NextAction.NONE);
        if (approvalRequired && (allowed || nextAction != NextAction.PREVIEW_THEN_APPROVE)) {
            throw new IllegalArgumentException("approval-required decision must be a preview_then_approve denial");
        }
    }

    public static GateDecision allow(long estimatedBytes, double estimatedCostUsd) {
        return new GateDecision(true, List.of(), false, NextAction.NONE, estimatedBytes, estimatedCostUsd);
    }

    public static GateDecision deny(List<String> reasons, NextAction nextAction, long estimatedBytes, double estimatedCostUsd) {
        return new GateDecision(false, reasons, false, nextAction, estimatedBytes, estimatedCostUsd);
    }

    public static GateDecision approvalRequired(List<String> reasons, long estimatedBytes, double estimatedCostUsd) {
        return new GateDecision(false, reasons, true, NextAction.PREVIEW_THEN_APPROVE, estimatedBytes, estimatedCostUsd);
    }
}
