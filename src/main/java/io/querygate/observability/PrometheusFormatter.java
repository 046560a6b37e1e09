package io.querygate.observability;

import io.querygate.runtime.QueryGateRuntime;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(QueryGateRuntime.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "querygate_gate_decisions_total", "Gate decisions grouped by verdict", "verdict", "allowed", stats.gateAllowed());
        appendGauge(sb, "querygate_gate_decisions_total", "Gate decisions grouped by verdict", "verdict", "denied", stats.gateDenied());
        appendGauge(sb, "querygate_gate_decisions_total", "Gate decisions grouped by verdict", "verdict", "approval_required", stats.gateApprovalRequired());
        appendMapGauge(sb, "querygate_gate_denials_by_next_action", "Gate denials grouped by suggested next action", "next_action", stats.denialsByNextAction());
        appendMapGauge(sb, "querygate_steps_total", "Executed steps grouped by status", "status", stats.stepsByStatus());
        appendGauge(sb, "querygate_step_retries_total", "Backend call retries across all steps", null, null, stats.retries());
        appendMapGauge(sb, "querygate_runs_total", "Runs grouped by response type", "response_type", stats.runsByResponseType());
        appendGauge(sb, "querygate_idempotency_lookups_total", "Idempotency cache lookups grouped by result", "result", "hit", stats.idempotencyHits());
        appendGauge(sb, "querygate_idempotency_lookups_total", "Idempotency cache lookups grouped by result", "result", "miss", stats.idempotencyMisses());
        appendGauge(sb, "querygate_idempotency_entries", "Stored idempotent step outcomes", null, null, stats.idempotencyEntries());
        appendGauge(sb, "querygate_bytes_recorded_total", "Scanned bytes recorded against tenant budgets", null, null, stats.bytesRecorded());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
