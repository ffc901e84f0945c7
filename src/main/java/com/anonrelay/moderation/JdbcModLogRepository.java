package com.anonrelay.moderation;

import com.anonrelay.shared.model.ModAction;
import com.anonrelay.shared.model.ModLogEntry;
import com.anonrelay.shared.model.Timestamps;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public class JdbcModLogRepository implements ModLogRepository {

    private final DataSource dataSource;

    public JdbcModLogRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(long moderatorId, ModAction action, Long messageId, Long targetUserId,
                       String details, LocalDateTime createdAt) {
        var sql = "INSERT INTO mod_log (moderator_id, action, message_id, target_user_id, details, created_at) "
                + "VALUES (?, ?, ?, ?, ?, ?)";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, moderatorId);
            ps.setString(2, action.code());
            if (messageId != null) ps.setLong(3, messageId); else ps.setNull(3, Types.BIGINT);
            if (targetUserId != null) ps.setLong(4, targetUserId); else ps.setNull(4, Types.BIGINT);
            ps.setString(5, details);
            ps.setString(6, Timestamps.format(createdAt));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record mod action " + action.code(), e);
        }
    }

    @Override
    public List<ModLogEntry> findRecent(int limit) {
        var sql = "SELECT id, moderator_id, action, message_id, target_user_id, details, created_at "
                + "FROM mod_log ORDER BY created_at DESC, id DESC LIMIT ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (var rs = ps.executeQuery()) {
                var entries = new ArrayList<ModLogEntry>();
                while (rs.next()) entries.add(map(rs));
                return entries;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load mod log", e);
        }
    }

    private static ModLogEntry map(ResultSet rs) throws SQLException {
        var messageId = rs.getLong("message_id");
        Long msg = rs.wasNull() ? null : messageId;
        var target = rs.getLong("target_user_id");
        Long targetUser = rs.wasNull() ? null : target;
        return new ModLogEntry(
                rs.getLong("id"),
                rs.getLong("moderator_id"),
                ModAction.fromCode(rs.getString("action")),
                msg,
                targetUser,
                rs.getString("details"),
                Timestamps.parse(rs.getString("created_at")));
    }
}
