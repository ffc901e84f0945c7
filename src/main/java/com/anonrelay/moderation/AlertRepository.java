package com.anonrelay.moderation;

import com.anonrelay.shared.model.Alert;
import com.anonrelay.shared.model.AlertType;

import java.time.LocalDateTime;
import java.util.List;

public interface AlertRepository {
    long insert(AlertType type, Long userId, String details, LocalDateTime createdAt);
    boolean resolve(long alertId);
    List<Alert> findUnresolved();
}
