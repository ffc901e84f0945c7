package com.anonrelay.relay;

import com.anonrelay.shared.model.MediaKind;
import com.anonrelay.shared.model.Message;
import com.anonrelay.shared.model.MessageContent;
import com.anonrelay.shared.model.MessageStatus;
import com.anonrelay.shared.model.Sentiment;
import com.anonrelay.shared.model.Timestamps;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public class JdbcMessageRepository implements MessageRepository {

    private static final String COLUMNS = "id, sender_id, receiver_id, content, media_type, media_file_id, caption, "
            + "status, is_read, read_at, reply_to_id, published_ref, sentiment, is_urgent, created_at";

    private final DataSource dataSource;

    public JdbcMessageRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Message insert(NewMessage m) {
        var sql = "INSERT INTO messages (sender_id, receiver_id, content, media_type, media_file_id, caption, "
                + "status, reply_to_id, sentiment, is_urgent, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, m.senderId());
            ps.setLong(2, m.receiverId());
            if (m.content() instanceof MessageContent.Media media) {
                ps.setString(3, null);
                ps.setString(4, media.kind().code());
                ps.setString(5, media.fileRef());
                ps.setString(6, media.caption());
            } else {
                ps.setString(3, m.content().plainText());
                ps.setString(4, null);
                ps.setString(5, null);
                ps.setString(6, null);
            }
            ps.setString(7, m.status().name());
            if (m.replyToId() != null) ps.setLong(8, m.replyToId()); else ps.setNull(8, Types.BIGINT);
            ps.setString(9, m.sentiment() != null ? m.sentiment().name() : null);
            ps.setBoolean(10, m.urgent());
            ps.setString(11, Timestamps.format(m.createdAt()));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("No generated key for message");
                return new Message(keys.getLong(1), m.senderId(), m.receiverId(), m.content(), m.status(),
                        false, null, m.replyToId(), null, m.sentiment(), m.urgent(), m.createdAt());
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save message from " + m.senderId(), e);
        }
    }

    @Override
    public Optional<Message> findById(long id) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM messages WHERE id = ?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load message " + id, e);
        }
    }

    @Override
    public boolean compareAndSetStatus(long id, MessageStatus expected, MessageStatus next) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("UPDATE messages SET status = ? WHERE id = ? AND status = ?")) {
            ps.setString(1, next.name());
            ps.setLong(2, id);
            ps.setString(3, expected.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update status of message " + id, e);
        }
    }

    @Override
    public boolean setPublishedRef(long id, String ref) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("UPDATE messages SET published_ref = ? WHERE id = ? AND published_ref IS NULL")) {
            ps.setString(1, ref);
            ps.setLong(2, id);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store published ref of message " + id, e);
        }
    }

    @Override
    public boolean markRead(long id, LocalDateTime readAt) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("UPDATE messages SET is_read = TRUE, read_at = ? WHERE id = ? AND is_read = FALSE")) {
            ps.setString(1, Timestamps.format(readAt));
            ps.setLong(2, id);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark message " + id + " read", e);
        }
    }

    @Override
    public List<Message> findApprovedForReceiver(long receiverId, int limit, int offset) {
        var sql = "SELECT " + COLUMNS + " FROM messages WHERE receiver_id = ? AND status = 'APPROVED' "
                + "ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, receiverId);
            ps.setInt(2, limit);
            ps.setInt(3, offset);
            return list(ps.executeQuery());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load inbox of user " + receiverId, e);
        }
    }

    @Override
    public List<Message> findUrgentPending() {
        var sql = "SELECT " + COLUMNS + " FROM messages WHERE is_urgent = TRUE AND status = 'PENDING' "
                + "ORDER BY created_at DESC, id DESC";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            return list(ps.executeQuery());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load urgent messages", e);
        }
    }

    @Override
    public long countSentSince(long senderId, LocalDateTime since) {
        return countWhere("sender_id = ? AND created_at >= ?", ps -> {
            ps.setLong(1, senderId);
            ps.setString(2, Timestamps.format(since));
        });
    }

    @Override
    public Map<MessageStatus, Long> countByStatus() {
        var counts = new EnumMap<MessageStatus, Long>(MessageStatus.class);
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT status, COUNT(*) FROM messages GROUP BY status");
             var rs = ps.executeQuery()) {
            while (rs.next()) counts.put(MessageStatus.valueOf(rs.getString(1)), rs.getLong(2));
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count messages by status", e);
        }
    }

    @Override
    public Map<Sentiment, Long> countBySentiment() {
        var counts = new EnumMap<Sentiment, Long>(Sentiment.class);
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(
                     "SELECT sentiment, COUNT(*) FROM messages WHERE sentiment IS NOT NULL GROUP BY sentiment");
             var rs = ps.executeQuery()) {
            while (rs.next()) counts.put(Sentiment.valueOf(rs.getString(1)), rs.getLong(2));
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count messages by sentiment", e);
        }
    }

    @Override
    public long countUrgentPending() {
        return countWhere("status = 'PENDING' AND is_urgent = TRUE", ps -> {});
    }

    @Override
    public long countCreatedSince(LocalDateTime since) {
        return countWhere("created_at >= ?", ps -> ps.setString(1, Timestamps.format(since)));
    }

    @Override
    public Map<Integer, Long> countByHour() {
        var counts = new TreeMap<Integer, Long>();
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(
                     "SELECT SUBSTRING(created_at FROM 12 FOR 2) AS hour, COUNT(*) FROM messages GROUP BY hour");
             var rs = ps.executeQuery()) {
            while (rs.next()) counts.put(Integer.parseInt(rs.getString(1)), rs.getLong(2));
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count messages by hour", e);
        }
    }

    @Override
    public List<LocalDateTime> createdSince(LocalDateTime since) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT created_at FROM messages WHERE created_at > ? ORDER BY created_at")) {
            ps.setString(1, Timestamps.format(since));
            try (var rs = ps.executeQuery()) {
                var times = new ArrayList<LocalDateTime>();
                while (rs.next()) times.add(Timestamps.parse(rs.getString(1)));
                return times;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load message activity", e);
        }
    }

    @Override
    public long countApprovedReceived(long userId) {
        return countWhere("receiver_id = ? AND status = 'APPROVED'", ps -> ps.setLong(1, userId));
    }

    @Override
    public long countApprovedSent(long userId) {
        return countWhere("sender_id = ? AND status = 'APPROVED'", ps -> ps.setLong(1, userId));
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private long countWhere(String where, Binder binder) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT COUNT(*) FROM messages WHERE " + where)) {
            binder.bind(ps);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count messages", e);
        }
    }

    private static List<Message> list(ResultSet rs) throws SQLException {
        try (rs) {
            var messages = new ArrayList<Message>();
            while (rs.next()) messages.add(map(rs));
            return messages;
        }
    }

    private static Message map(ResultSet rs) throws SQLException {
        var mediaType = rs.getString("media_type");
        MessageContent content = mediaType != null
                ? MessageContent.media(MediaKind.fromCode(mediaType), rs.getString("media_file_id"), rs.getString("caption"))
                : MessageContent.text(rs.getString("content"));
        var replyTo = rs.getLong("reply_to_id");
        Long replyToId = rs.wasNull() ? null : replyTo;
        var sentiment = rs.getString("sentiment");
        return new Message(
                rs.getLong("id"),
                rs.getLong("sender_id"),
                rs.getLong("receiver_id"),
                content,
                MessageStatus.valueOf(rs.getString("status")),
                rs.getBoolean("is_read"),
                Timestamps.parse(rs.getString("read_at")),
                replyToId,
                rs.getString("published_ref"),
                sentiment != null ? Sentiment.valueOf(sentiment) : null,
                rs.getBoolean("is_urgent"),
                Timestamps.parse(rs.getString("created_at")));
    }
}
