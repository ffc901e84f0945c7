package com.anonrelay.gateway.http;

import com.anonrelay.analytics.AnalyticsAggregator;
import com.anonrelay.analytics.AnalyticsSummary;
import com.anonrelay.analytics.DailyCount;
import com.anonrelay.relay.JdbcMessageRepository;
import com.anonrelay.shared.error.ValidationException;
import com.anonrelay.shared.model.MessageStatus;
import com.anonrelay.shared.model.Sentiment;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/analytics")
public class AnalyticsController {

    private final AnalyticsAggregator analytics;

    @Autowired
    public AnalyticsController(DataSource dataSource) {
        this(new AnalyticsAggregator(new JdbcMessageRepository(dataSource), Clock.systemDefaultZone()));
    }

    AnalyticsController(AnalyticsAggregator analytics) {
        this.analytics = analytics;
    }

    @GetMapping("/summary")
    public AnalyticsSummary summary() {
        return analytics.summary();
    }

    @GetMapping("/status")
    public Map<MessageStatus, Long> status() {
        return analytics.countsByStatus();
    }

    @GetMapping("/sentiment")
    public Map<Sentiment, Long> sentiment() {
        return analytics.sentimentStats();
    }

    @GetMapping("/hourly")
    public int[] hourly(@RequestParam(defaultValue = "7") int days) {
        return analytics.hourlyActivity(days);
    }

    @GetMapping("/weekly")
    public int[][] weekly(@RequestParam(defaultValue = "30") int days) {
        return analytics.weeklyActivity(days);
    }

    @GetMapping("/daily")
    public List<DailyCount> daily(@RequestParam(defaultValue = "30") int days) {
        return analytics.dailyActivity(days);
    }

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(ValidationException e) {
        return Map.of("error", e.getMessage());
    }
}
