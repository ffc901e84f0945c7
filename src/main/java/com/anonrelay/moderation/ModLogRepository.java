package com.anonrelay.moderation;

import com.anonrelay.shared.model.ModAction;
import com.anonrelay.shared.model.ModLogEntry;

import java.time.LocalDateTime;
import java.util.List;

public interface ModLogRepository {
    void insert(long moderatorId, ModAction action, Long messageId, Long targetUserId,
                String details, LocalDateTime createdAt);
    List<ModLogEntry> findRecent(int limit);
}
