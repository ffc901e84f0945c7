package com.anonrelay.ratelimit;

import com.anonrelay.shared.model.RateLimitState;
import com.anonrelay.shared.model.Timestamps;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.Optional;

public class JdbcRateLimitRepository implements RateLimitRepository {

    private final DataSource dataSource;

    public JdbcRateLimitRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<RateLimitState> find(long userId) {
        var sql = "SELECT user_id, window_start, message_count, is_blocked, blocked_until FROM rate_limits WHERE user_id = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, userId);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new RateLimitState(
                        rs.getLong("user_id"),
                        Timestamps.parse(rs.getString("window_start")),
                        rs.getInt("message_count"),
                        rs.getBoolean("is_blocked"),
                        Timestamps.parse(rs.getString("blocked_until"))));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load rate limit for user " + userId, e);
        }
    }

    @Override
    public boolean insertIfAbsent(RateLimitState state) {
        var sql = "INSERT INTO rate_limits (user_id, window_start, message_count, is_blocked, blocked_until) "
                + "VALUES (?, ?, ?, ?, ?) ON CONFLICT (user_id) DO NOTHING";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, state.userId());
            ps.setString(2, Timestamps.format(state.windowStart()));
            ps.setInt(3, state.messageCount());
            ps.setBoolean(4, state.blocked());
            ps.setString(5, Timestamps.format(state.blockedUntil()));
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert rate limit for user " + state.userId(), e);
        }
    }

    @Override
    public boolean update(RateLimitState state) {
        var sql = "UPDATE rate_limits SET window_start = ?, message_count = ?, is_blocked = ?, blocked_until = ? "
                + "WHERE user_id = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, Timestamps.format(state.windowStart()));
            ps.setInt(2, state.messageCount());
            ps.setBoolean(3, state.blocked());
            ps.setString(4, Timestamps.format(state.blockedUntil()));
            ps.setLong(5, state.userId());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update rate limit for user " + state.userId(), e);
        }
    }

    @Override
    public void block(long userId, LocalDateTime until, LocalDateTime now) {
        var sql = "INSERT INTO rate_limits (user_id, window_start, message_count, is_blocked, blocked_until) "
                + "VALUES (?, ?, 0, TRUE, ?) "
                + "ON CONFLICT (user_id) DO UPDATE SET is_blocked = TRUE, blocked_until = EXCLUDED.blocked_until";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, userId);
            ps.setString(2, Timestamps.format(now));
            ps.setString(3, Timestamps.format(until));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to block user " + userId, e);
        }
    }

    @Override
    public void unblock(long userId, LocalDateTime now) {
        var sql = "UPDATE rate_limits SET is_blocked = FALSE, blocked_until = NULL, message_count = 0, window_start = ? "
                + "WHERE user_id = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, Timestamps.format(now));
            ps.setLong(2, userId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to unblock user " + userId, e);
        }
    }
}
