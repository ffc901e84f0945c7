package com.anonrelay.relay;

import com.anonrelay.shared.model.Message;
import com.anonrelay.shared.model.MessageStatus;
import com.anonrelay.shared.model.Sentiment;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface MessageRepository {
    Message insert(NewMessage message);
    Optional<Message> findById(long id);

    /** Conditional status update; true only for the single caller that saw {@code expected}. */
    boolean compareAndSetStatus(long id, MessageStatus expected, MessageStatus next);
    /** Sets the published reference once; later calls are no-ops returning false. */
    boolean setPublishedRef(long id, String ref);
    /** Marks the message read once; later calls are no-ops returning false. */
    boolean markRead(long id, LocalDateTime readAt);

    List<Message> findApprovedForReceiver(long receiverId, int limit, int offset);
    List<Message> findUrgentPending();
    long countSentSince(long senderId, LocalDateTime since);

    // aggregate reads
    Map<MessageStatus, Long> countByStatus();
    Map<Sentiment, Long> countBySentiment();
    long countUrgentPending();
    long countCreatedSince(LocalDateTime since);
    List<LocalDateTime> createdSince(LocalDateTime since);
    /** All-time message count per hour of day (0-23); hours with no messages are absent. */
    Map<Integer, Long> countByHour();
    long countApprovedReceived(long userId);
    long countApprovedSent(long userId);
}
