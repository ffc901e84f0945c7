package com.anonrelay.moderation;

import com.anonrelay.shared.model.Alert;
import com.anonrelay.shared.model.AlertType;
import com.anonrelay.shared.model.Timestamps;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public class JdbcAlertRepository implements AlertRepository {

    private final DataSource dataSource;

    public JdbcAlertRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public long insert(AlertType type, Long userId, String details, LocalDateTime createdAt) {
        var sql = "INSERT INTO alerts (alert_type, user_id, details, created_at) VALUES (?, ?, ?, ?)";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, type.code());
            if (userId != null) ps.setLong(2, userId); else ps.setNull(2, Types.BIGINT);
            ps.setString(3, details);
            ps.setString(4, Timestamps.format(createdAt));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                return keys.next() ? keys.getLong(1) : -1;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert alert " + type.code(), e);
        }
    }

    @Override
    public boolean resolve(long alertId) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("UPDATE alerts SET is_resolved = TRUE WHERE id = ? AND is_resolved = FALSE")) {
            ps.setLong(1, alertId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to resolve alert " + alertId, e);
        }
    }

    @Override
    public List<Alert> findUnresolved() {
        var sql = "SELECT id, alert_type, user_id, details, is_resolved, created_at FROM alerts "
                + "WHERE is_resolved = FALSE ORDER BY created_at DESC, id DESC";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql);
             var rs = ps.executeQuery()) {
            var alerts = new ArrayList<Alert>();
            while (rs.next()) {
                var userId = rs.getLong("user_id");
                alerts.add(new Alert(
                        rs.getLong("id"),
                        AlertType.fromCode(rs.getString("alert_type")),
                        rs.wasNull() ? null : userId,
                        rs.getString("details"),
                        rs.getBoolean("is_resolved"),
                        Timestamps.parse(rs.getString("created_at"))));
            }
            return alerts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load unresolved alerts", e);
        }
    }
}
