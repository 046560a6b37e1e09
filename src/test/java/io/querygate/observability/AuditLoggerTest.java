package io.querygate.observability;

import io.querygate.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {
    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");

    @Test
    void chainVerifiesAndSurvivesReopen() throws Exception {
        Path root = Files.createTempDirectory("querygate-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "secret-1", clock);
            logger.log(AuditLogger.AuditEvent.of("gate.decision", "acme", "wf-1", null, "allowed", Map.of("n", 1)));
            logger.log(AuditLogger.AuditEvent.of("step.outcome", "acme", "wf-1", "step_1", "success", Map.of()));
            String head = logger.currentHash();

            AuditLogger reopened = new AuditLogger(file, "secret-1", clock);
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("budget.record", "acme", null, null, "ok", Map.of("bytes", 10)));

            AuditLogger.VerifyResult result = reopened.verify();
            Assertions.assertTrue(result.ok(), result.message());
            Assertions.assertEquals(3, result.rowsChecked());

            List<Map<String, Object>> tail = reopened.tail(2);
            Assertions.assertEquals(2, tail.size());
            Assertions.assertEquals("step.outcome", tail.get(0).get("action"));
            Assertions.assertEquals(head, tail.get(1).get("prev_hash"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowIsDetected() throws Exception {
        Path root = Files.createTempDirectory("querygate-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "secret-1", clock);
            logger.log(AuditLogger.AuditEvent.of("gate.decision", "acme", "wf-1", null, "denied", Map.of()));
            logger.log(AuditLogger.AuditEvent.of("gate.decision", "acme", "wf-2", null, "allowed", Map.of()));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(0, lines.get(0).replace("\"denied\"", "\"allowed\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.VerifyResult result = logger.verify();
            Assertions.assertFalse(result.ok());
            Assertions.assertEquals(1, result.brokenAtRow());
            Assertions.assertEquals("row hash mismatch", result.message());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void wrongSecretFailsSignatureCheck() throws Exception {
        Path root = Files.createTempDirectory("querygate-test-audit-sign-");
        try {
            Path file = root.resolve("audit.log");
            new AuditLogger(file, "secret-1", clock)
                    .log(AuditLogger.AuditEvent.of("gate.decision", "acme", "wf-1", null, "allowed", Map.of()));

            AuditLogger.VerifyResult result = new AuditLogger(file, "secret-2", clock).verify();
            Assertions.assertFalse(result.ok());
            Assertions.assertEquals("signature mismatch", result.message());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sqlLiteralsAndSecretsAreMaskedInDetails() throws Exception {
        Path root = Files.createTempDirectory("querygate-test-audit-mask-");
        try {
            AuditLogger logger = new AuditLogger(root.resolve("audit.log"), "", clock);
            logger.log(AuditLogger.AuditEvent.of("gate.decision", "acme", "wf-1", null, "allowed", Map.of(
                    "sql", List.of("SELECT id FROM users WHERE email = 'a@b.com' LIMIT 5"),
                    "api_token", "abc"
            )));

            @SuppressWarnings("unchecked")
            Map<String, Object> details = (Map<String, Object>) logger.tail(1).get(0).get("details");
            Assertions.assertEquals(List.of("SELECT id FROM users WHERE email = '***' LIMIT 5"), details.get("sql"));
            Assertions.assertEquals("***", details.get("api_token"));
            Assertions.assertFalse(logger.tail(1).get(0).containsKey("signature"));
            Assertions.assertTrue(logger.verify().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
