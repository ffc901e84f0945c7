package com.anonrelay.identity;

import com.anonrelay.shared.model.Timestamps;
import com.anonrelay.shared.model.User;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.Optional;

public class JdbcUserRepository implements UserRepository {

    private static final String COLUMNS = "id, external_id, code, display_name, is_active, created_at";

    private final DataSource dataSource;

    public JdbcUserRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<User> findByExternalId(long externalId) {
        return findOne("SELECT " + COLUMNS + " FROM users WHERE external_id = ?", externalId);
    }

    @Override
    public Optional<User> findById(long internalId) {
        return findOne("SELECT " + COLUMNS + " FROM users WHERE id = ?", internalId);
    }

    @Override
    public Optional<User> findByCode(String code) {
        var sql = "SELECT " + COLUMNS + " FROM users WHERE code = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, code);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up user by code", e);
        }
    }

    @Override
    public Optional<User> insert(long externalId, String code, String displayName, LocalDateTime createdAt) {
        // no conflict target: a clash on either external_id or code skips the row
        var sql = "INSERT INTO users (external_id, code, display_name, created_at) VALUES (?, ?, ?, ?) "
                + "ON CONFLICT DO NOTHING";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, externalId);
            ps.setString(2, code);
            ps.setString(3, displayName);
            ps.setString(4, Timestamps.format(createdAt));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert user " + externalId, e);
        }
        // a missing row after a skipped insert means the code was taken
        return findByExternalId(externalId);
    }

    @Override
    public void updateDisplayName(long internalId, String displayName) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("UPDATE users SET display_name = ? WHERE id = ?")) {
            ps.setString(1, displayName);
            ps.setLong(2, internalId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update display name for user " + internalId, e);
        }
    }

    private Optional<User> findOne(String sql, long key) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load user " + key, e);
        }
    }

    private static User map(ResultSet rs) throws SQLException {
        return new User(
                rs.getLong("id"),
                rs.getLong("external_id"),
                rs.getString("code"),
                rs.getString("display_name"),
                rs.getBoolean("is_active"),
                Timestamps.parse(rs.getString("created_at")));
    }
}
