package io.querygate.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.querygate.security.SensitiveDataMasker;
import io.querygate.util.Hashing;
import io.querygate.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only JSONL log of gate decisions and step outcomes. Each row carries the hash of the row
 * before it, and an HMAC of its own hash when a signing secret is configured.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final Path auditFile;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret, Clock clock) {
        this.auditFile = Objects.requireNonNull(auditFile, "auditFile");
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = Objects.requireNonNull(clock, "clock");
        try {
            Files.createDirectories(auditFile.toAbsolutePath().getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException raced) {
                    log.debug("Audit log created concurrently: {}", auditFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("tenant_id", event.tenantId());
        row.put("workflow_id", event.workflowId());
        row.put("step", event.step());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /** Last {@code limit} rows, oldest first. */
    public synchronized List<Map<String, Object>> tail(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<Map<String, Object>> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            out.add(parseRow(line));
        }
        return out;
    }

    /**
     * Recomputes every row hash, checks the chain links and, when a secret is configured, the
     * signatures. Stops at the first broken row.
     */
    public synchronized VerifyResult verify() {
        String expectedPrev = "";
        int checked = 0;
        for (String line : readLines()) {
            checked++;
            Map<String, Object> row;
            try {
                row = Jsons.mapper().readValue(line, ROW_TYPE);
            } catch (JsonProcessingException e) {
                return VerifyResult.broken(checked, "unparseable row");
            }
            Object storedHash = row.remove("hash");
            Object signature = row.remove("signature");
            if (!expectedPrev.equals(String.valueOf(row.get("prev_hash")))) {
                return VerifyResult.broken(checked, "prev_hash does not match previous row");
            }
            String recomputed = Hashing.sha256Hex(toCompactJson(row));
            if (!recomputed.equals(storedHash)) {
                return VerifyResult.broken(checked, "row hash mismatch");
            }
            if (!signingSecret.isBlank()) {
                if (signature == null || !Hashing.hmacSha256Hex(signingSecret, recomputed).equals(signature)) {
                    return VerifyResult.broken(checked, "signature mismatch");
                }
            }
            expectedPrev = recomputed;
        }
        return new VerifyResult(true, checked, -1, "ok");
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        try {
            JsonNode node = Jsons.mapper().readTree(lines.get(lines.size() - 1));
            return node.path("hash").asText("");
        } catch (JsonProcessingException e) {
            log.warn("Last audit row is unreadable, starting a new chain: {}", auditFile);
            return "";
        }
    }

    private static Map<String, Object> parseRow(String line) {
        try {
            return Jsons.mapper().readValue(line, ROW_TYPE);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse audit row", e);
        }
    }

    private static Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, ROW_TYPE);
    }

    private static String toCompactJson(Map<String, Object> row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }

    public record AuditEvent(
            String action,
            String tenantId,
            String workflowId,
            String step,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String tenantId,
                String workflowId,
                String step,
                String result,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, tenantId, workflowId, step, result, details == null ? Map.of() : details);
        }
    }

    public record VerifyResult(boolean ok, int rowsChecked, int brokenAtRow, String message) {
        static VerifyResult broken(int row, String message) {
            return new VerifyResult(false, row, row, message);
        }
    }
}
