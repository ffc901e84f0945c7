package com.anonrelay.tokens;

import com.anonrelay.shared.model.ReplyToken;
import com.anonrelay.shared.model.Timestamps;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Optional;

public class JdbcReplyTokenRepository implements ReplyTokenRepository {

    private final DataSource dataSource;

    public JdbcReplyTokenRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean insertIfAbsent(ReplyToken token) {
        var sql = "INSERT INTO reply_tokens (hash, sender_id, receiver_id, created_at) VALUES (?, ?, ?, ?) "
                + "ON CONFLICT (hash) DO NOTHING";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, token.hash());
            ps.setLong(2, token.senderId());
            ps.setLong(3, token.receiverId());
            ps.setString(4, Timestamps.format(token.createdAt()));
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save reply token", e);
        }
    }

    @Override
    public Optional<ReplyToken> findByHash(String hash) {
        var sql = "SELECT hash, sender_id, receiver_id, created_at FROM reply_tokens WHERE hash = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, hash);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new ReplyToken(
                        rs.getString("hash"),
                        rs.getLong("sender_id"),
                        rs.getLong("receiver_id"),
                        Timestamps.parse(rs.getString("created_at"))));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to resolve reply token", e);
        }
    }

    @Override
    public boolean existsForPair(long senderId, long receiverId) {
        var sql = "SELECT 1 FROM reply_tokens WHERE sender_id = ? AND receiver_id = ? LIMIT 1";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, senderId);
            ps.setLong(2, receiverId);
            try (var rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up reply token pair", e);
        }
    }
}
