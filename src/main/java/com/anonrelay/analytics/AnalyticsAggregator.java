package com.anonrelay.analytics;

import com.anonrelay.relay.MessageRepository;
import com.anonrelay.shared.error.ValidationException;
import com.anonrelay.shared.model.MessageStatus;
import com.anonrelay.shared.model.Sentiment;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only grouped counts over stored messages. Hours and weekdays are taken from the stored
 * local timestamps as-is.
 */
public class AnalyticsAggregator {

    private final MessageRepository messages;
    private final Clock clock;

    public AnalyticsAggregator(MessageRepository messages, Clock clock) {
        this.messages = messages;
        this.clock = clock;
    }

    public AnalyticsSummary summary() {
        var now = LocalDateTime.now(clock);
        var byStatus = messages.countByStatus();
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();

        Integer peakHour = null;
        long peak = 0;
        for (var e : messages.countByHour().entrySet()) {
            // ties resolve to the earliest hour
            if (e.getValue() > peak) {
                peak = e.getValue();
                peakHour = e.getKey();
            }
        }
        return new AnalyticsSummary(
                total,
                messages.countCreatedSince(now.toLocalDate().atStartOfDay()),
                messages.countCreatedSince(now.minusDays(7)),
                byStatus.getOrDefault(MessageStatus.PENDING, 0L),
                messages.countUrgentPending(),
                messages.countBySentiment(),
                peakHour);
    }

    public Map<MessageStatus, Long> countsByStatus() {
        return messages.countByStatus();
    }

    public Map<Sentiment, Long> sentimentStats() {
        return messages.countBySentiment();
    }

    /** Messages per hour of day over the last {@code days} days. */
    public int[] hourlyActivity(int days) {
        var hours = new int[24];
        for (var t : since(days)) hours[t.getHour()]++;
        return hours;
    }

    /** Rows are weekdays with Monday first, columns hours of day. */
    public int[][] weeklyActivity(int days) {
        var grid = new int[7][24];
        for (var t : since(days)) grid[t.getDayOfWeek().getValue() - 1][t.getHour()]++;
        return grid;
    }

    /** Days with at least one message, oldest first. */
    public List<DailyCount> dailyActivity(int days) {
        var perDay = new TreeMap<LocalDate, Long>();
        for (var t : since(days)) perDay.merge(t.toLocalDate(), 1L, Long::sum);
        var result = new ArrayList<DailyCount>(perDay.size());
        perDay.forEach((date, count) -> result.add(new DailyCount(date, count)));
        return result;
    }

    public UserStats userStats(long userId) {
        return new UserStats(messages.countApprovedReceived(userId), messages.countApprovedSent(userId));
    }

    public long sentToday(long userId) {
        return messages.countSentSince(userId, LocalDate.now(clock).atStartOfDay());
    }

    private List<LocalDateTime> since(int days) {
        if (days <= 0) throw new ValidationException("days must be positive: " + days);
        return messages.createdSince(LocalDateTime.now(clock).minusDays(days));
    }
}
