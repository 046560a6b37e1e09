package io.querygate.cli;

import io.querygate.config.QueryGateConfig;
import io.querygate.model.BudgetStatus;
import io.querygate.model.GateResult;
import io.querygate.model.QueryPlan;
import io.querygate.model.SqlVerdict;
import io.querygate.observability.AuditLogger;
import io.querygate.runtime.QueryGateRuntime;
import io.querygate.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "querygate",
        mixinStandardHelpOptions = true,
        description = "Safety, cost and retry gate for generated data queries",
        subcommands = {
                QueryGateCommand.InitCommand.class,
                QueryGateCommand.EvaluateSqlCommand.class,
                QueryGateCommand.GateCommand.class,
                QueryGateCommand.RunCommand.class,
                QueryGateCommand.BudgetCommand.class,
                QueryGateCommand.RecordUsageCommand.class,
                QueryGateCommand.StatsCommand.class,
                QueryGateCommand.MetricsCommand.class,
                QueryGateCommand.AuditTailCommand.class,
                QueryGateCommand.AuditVerifyCommand.class,
                QueryGateCommand.PurgeCommand.class
        }
)
public final class QueryGateCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | evaluate-sql | gate | run | budget | record-usage | stats | metrics | audit-tail | audit-verify | purge");
    }

    QueryGateRuntime runtime() {
        QueryGateRuntime runtime = new QueryGateRuntime(QueryGateConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    static QueryPlan readPlan(String planFile) {
        Path path = Paths.get(planFile);
        try {
            return Jsons.mapper().readValue(path.toFile(), QueryPlan.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read plan file: " + path, e);
        }
    }

    @Command(name = "init", description = "Initialize the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        QueryGateCommand parent;

        @Override
        public Integer call() {
            try (QueryGateRuntime runtime = parent.runtime()) {
                System.out.println("Initialized QueryGate at: " + QueryGateConfig.fromRoot(parent.root).rootDir());
            }
            return 0;
        }
    }

    @Command(name = "evaluate-sql", description = "Run the static SQL safety checks and print the verdict")
    static final class EvaluateSqlCommand implements Callable<Integer> {
        @ParentCommand
        QueryGateCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Option(names = {"--sql"}, required = true, description = "SQL text")
        String sql;

        @Override
        public Integer call() {
            try (QueryGateRuntime runtime = parent.runtime()) {
                SqlVerdict verdict = runtime.evaluateSql(tenant, sql);
                System.out.println(Jsons.toJson(verdict));
                return verdict.allowed() ? 0 : 2;
            }
        }
    }

    @Command(name = "gate", description = "Gate a plan without executing it")
    static final class GateCommand implements Callable<Integer> {
        @ParentCommand
        QueryGateCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Option(names = {"--plan"}, required = true, description = "Plan JSON file")
        String plan;

        @Override
        public Integer call() {
            try (QueryGateRuntime runtime = parent.runtime()) {
                GateResult result = runtime.preview(tenant, readPlan(plan));
                System.out.println(Jsons.toJson(result));
                return result.allowed() ? 0 : 2;
            }
        }
    }

    @Command(name = "run", description = "Gate and execute a plan")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        QueryGateCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Option(names = {"--workflow"}, required = true, description = "Workflow id; reruns with the same id replay finished steps")
        String workflow;

        @Option(names = {"--plan"}, required = true, description = "Plan JSON file")
        String plan;

        @Override
        public Integer call() {
            try (QueryGateRuntime runtime = parent.runtime()) {
                QueryGateRuntime.RunOutcome outcome = runtime.run(tenant, workflow, readPlan(plan));
                System.out.println(Jsons.toJson(outcome));
                return switch (outcome.responseType()) {
                    case QueryGateRuntime.QUERY_RESULT -> 0;
                    case QueryGateRuntime.BLOCKED -> 2;
                    default -> 1;
                };
            }
        }
    }

    @Command(name = "budget", description = "Show the tenant's hourly budget window")
    static final class BudgetCommand implements Callable<Integer> {
        @ParentCommand
        QueryGateCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Option(names = {"--estimate"}, defaultValue = "0", description = "Bytes to check against the remaining budget")
        long estimate;

        @Override
        public Integer call() {
            try (QueryGateRuntime runtime = parent.runtime()) {
                BudgetStatus status = runtime.checkBudget(tenant, estimate);
                System.out.println(Jsons.toJson(status));
                return status.allowed() ? 0 : 2;
            }
        }
    }

    @Command(name = "record-usage", description = "Record scanned bytes against a tenant")
    static final class RecordUsageCommand implements Callable<Integer> {
        @ParentCommand
        QueryGateCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Option(names = {"--bytes"}, required = true, description = "Scanned bytes")
        long bytes;

        @Override
        public Integer call() {
            try (QueryGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.recordUsage(tenant, bytes)));
                return 0;
            }
        }
    }

    @Command(name = "stats", description = "Print runtime counters as JSON")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        QueryGateCommand parent;

        @Override
        public Integer call() {
            try (QueryGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.stats()));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Print runtime counters in Prometheus text format")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        QueryGateCommand parent;

        @Override
        public Integer call() {
            try (QueryGateRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
                return 0;
            }
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        QueryGateCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest rows")
        int lines;

        @Override
        public Integer call() {
            try (QueryGateRuntime runtime = parent.runtime()) {
                for (Map<String, Object> row : runtime.auditTail(lines)) {
                    System.out.println(Jsons.toCompactJson(row));
                }
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        QueryGateCommand parent;

        @Override
        public Integer call() {
            try (QueryGateRuntime runtime = parent.runtime()) {
                AuditLogger.VerifyResult out = runtime.verifyAuditIntegrity();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "purge", description = "Drop idempotent step outcomes older than the TTL")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        QueryGateCommand parent;

        @Option(names = {"--idempotency-ttl-days"}, defaultValue = "7",
                description = "Keep idempotent step outcomes newer than this value")
        int idempotencyTtlDays;

        @Override
        public Integer call() {
            try (QueryGateRuntime runtime = parent.runtime()) {
                int purged = runtime.purgeIdempotency(idempotencyTtlDays);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("idempotency_ttl_days", idempotencyTtlDays);
                out.put("purged", purged);
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }
}
