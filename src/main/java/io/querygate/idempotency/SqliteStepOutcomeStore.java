package io.querygate.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.querygate.model.IdempotencyKey;
import io.querygate.model.StepOutcome;
import io.querygate.model.StepStatus;
import io.querygate.model.Tool;
import io.querygate.storage.Database;
import io.querygate.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

public final class SqliteStepOutcomeStore implements StepOutcomeStore {
    private static final TypeReference<Map<String, Object>> OUTPUT_TYPE = new TypeReference<>() {
    };

    private final Database database;

    public SqliteStepOutcomeStore(Database database) {
        this.database = database;
    }

    @Override
    public Optional<StepOutcome> find(IdempotencyKey key) {
        String sql = """
                SELECT step_name,tool,status,output_json,output_hash,started_at_ms,finished_at_ms,retry_count,error
                FROM idempotent_steps WHERE idempotency_key=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key.value());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                String tool = rs.getString("tool");
                return Optional.of(new StepOutcome(
                        rs.getString("step_name"),
                        tool == null ? null : Tool.fromString(tool),
                        StepStatus.fromString(rs.getString("status")),
                        readOutput(rs.getString("output_json")),
                        rs.getString("output_hash"),
                        instantOrNull(rs, "started_at_ms"),
                        instantOrNull(rs, "finished_at_ms"),
                        rs.getInt("retry_count"),
                        rs.getString("error")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read idempotent step", e);
        }
    }

    @Override
    public boolean saveIfAbsent(IdempotencyKey key, StepOutcome outcome, Instant storedAt) {
        String sql = """
                INSERT OR IGNORE INTO idempotent_steps(
                    idempotency_key,step_name,tool,status,output_json,output_hash,
                    started_at_ms,finished_at_ms,retry_count,error,stored_at_ms
                ) VALUES(?,?,?,?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key.value());
            ps.setString(2, outcome.stepName());
            ps.setString(3, outcome.tool() == null ? null : outcome.tool().wireName());
            ps.setString(4, outcome.status().wireName());
            ps.setString(5, Jsons.toCompactJson(outcome.output()));
            ps.setString(6, outcome.outputHash());
            setInstant(ps, 7, outcome.startedAt());
            setInstant(ps, 8, outcome.finishedAt());
            ps.setInt(9, outcome.retryCount());
            ps.setString(10, outcome.error());
            ps.setLong(11, storedAt.toEpochMilli());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store idempotent step", e);
        }
    }

    @Override
    public int purgeStoredBefore(Instant cutoff) {
        String sql = "DELETE FROM idempotent_steps WHERE stored_at_ms<?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, cutoff.toEpochMilli());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge idempotent steps", e);
        }
    }

    @Override
    public long count() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM idempotent_steps");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count idempotent steps", e);
        }
    }

    private static Map<String, Object> readOutput(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return Jsons.mapper().readValue(json, OUTPUT_TYPE);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse stored step output", e);
        }
    }

    private static Instant instantOrNull(ResultSet rs, String column) throws SQLException {
        long raw = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(raw);
    }

    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }
}
