package io.querygate.budget;

import io.querygate.model.UsageEvent;
import io.querygate.storage.Database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class SqliteUsageEventStore implements UsageEventStore {
    private final Database database;

    public SqliteUsageEventStore(Database database) {
        this.database = database;
    }

    @Override
    public void append(UsageEvent event) {
        String sql = "INSERT INTO usage_events(tenant_id,occurred_at_ms,bytes) VALUES(?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, event.tenantId());
            ps.setLong(2, event.timestamp().toEpochMilli());
            ps.setLong(3, event.bytes());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record usage event", e);
        }
    }

    @Override
    public void pruneThrough(String tenantId, Instant cutoff) {
        String sql = "DELETE FROM usage_events WHERE tenant_id=? AND occurred_at_ms<=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, tenantId);
            ps.setLong(2, cutoff.toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to prune usage events", e);
        }
    }

    @Override
    public List<UsageEvent> events(String tenantId) {
        String sql = "SELECT tenant_id,occurred_at_ms,bytes FROM usage_events WHERE tenant_id=? ORDER BY occurred_at_ms ASC, id ASC";
        List<UsageEvent> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, tenantId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new UsageEvent(
                            rs.getString("tenant_id"),
                            Instant.ofEpochMilli(rs.getLong("occurred_at_ms")),
                            rs.getLong("bytes")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read usage events", e);
        }
        return out;
    }
}
