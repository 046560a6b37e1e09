package io.querygate.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Monotonic runtime counters kept in SQLite, so every process working on the same data root sees the
 * same totals. A counter is a name plus an optional label; unlabeled counters use the empty label.
 */
public final class CounterStore {
    private static final String UNLABELED = "";

    private final Database database;

    public CounterStore(Database database) {
        this.database = database;
    }

    public void increment(String name, long delta) {
        increment(name, UNLABELED, delta);
    }

    public void increment(String name, String label, long delta) {
        if (delta < 0L) {
            throw new IllegalArgumentException("delta must be non-negative: " + delta);
        }
        if (delta == 0L) {
            return;
        }
        String sql = "INSERT INTO runtime_counters(name,label,value) VALUES(?,?,?) "
                + "ON CONFLICT(name,label) DO UPDATE SET value=value+excluded.value";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, name);
            ps.setString(2, label == null ? UNLABELED : label);
            ps.setLong(3, delta);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to increment counter: " + name, e);
        }
    }

    public long value(String name) {
        return value(name, UNLABELED);
    }

    public long value(String name, String label) {
        String sql = "SELECT value FROM runtime_counters WHERE name=? AND label=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, name);
            ps.setString(2, label == null ? UNLABELED : label);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read counter: " + name, e);
        }
    }

    /** Labeled values of one counter, sorted by label. */
    public Map<String, Long> byLabel(String name) {
        String sql = "SELECT label,value FROM runtime_counters WHERE name=? AND label<>'' ORDER BY label";
        Map<String, Long> out = new TreeMap<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString("label"), rs.getLong("value"));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read counter: " + name, e);
        }
        return out;
    }
}
