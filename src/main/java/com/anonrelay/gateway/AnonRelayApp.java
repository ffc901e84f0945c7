package com.anonrelay.gateway;

import com.anonrelay.analytics.AnalyticsAggregator;
import com.anonrelay.channels.TelegramChannel;
import com.anonrelay.channels.TimeLimitedChannel;
import com.anonrelay.identity.IdentityRegistry;
import com.anonrelay.identity.JdbcUserRepository;
import com.anonrelay.moderation.AlertLog;
import com.anonrelay.moderation.JdbcAlertRepository;
import com.anonrelay.moderation.JdbcModLogRepository;
import com.anonrelay.observability.DoctorCommand;
import com.anonrelay.observability.RelayMetrics;
import com.anonrelay.ratelimit.JdbcRateLimitRepository;
import com.anonrelay.ratelimit.RateLimiter;
import com.anonrelay.relay.JdbcMessageRepository;
import com.anonrelay.relay.MessageRelay;
import com.anonrelay.sentiment.Lexicon;
import com.anonrelay.sentiment.SentimentClassifier;
import com.anonrelay.shared.config.ConfigLoader;
import com.anonrelay.tokens.JdbcReplyTokenRepository;
import com.anonrelay.tokens.ReplyTokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@SpringBootApplication(scanBasePackages = "com.anonrelay")
public class AnonRelayApp {

    private static final Logger log = LoggerFactory.getLogger(AnonRelayApp.class);

    public static void main(String[] args) {
        var ctx = SpringApplication.run(AnonRelayApp.class, args);
        var config = ConfigLoader.load();
        var dataSource = ctx.getBean(DataSource.class);
        var clock = Clock.systemDefaultZone();
        var metrics = new RelayMetrics();

        var doctor = new DoctorCommand(dataSource, config);
        log.info("Startup checks:\n{}", doctor.run());

        var token = config.telegramBotToken();
        if (token == null || token.isBlank()) {
            log.warn("Telegram bot token not configured. Set telegram.bot-token in ~/.anonrelay/config.yaml "
                    + "or ANONRELAY_BOT_TOKEN; only the analytics API is running");
            return;
        }

        // Executors
        var workers = Executors.newFixedThreadPool(config.workerThreads(), namedThreads("relay-worker-"));
        var outbound = Executors.newCachedThreadPool(namedThreads("relay-outbound-"));
        var auditWriter = Executors.newSingleThreadExecutor(namedThreads("relay-audit-"));

        // Transport
        var telegram = new TelegramChannel(token, workers);
        var channel = new TimeLimitedChannel(telegram, Duration.ofSeconds(config.outboundTimeoutSeconds()), outbound);

        // Core services
        var lexicon = config.lexiconPath() != null ? Lexicon.load(config.lexiconPath()) : Lexicon.defaults();
        var identities = new IdentityRegistry(new JdbcUserRepository(dataSource), clock);
        var tokens = new ReplyTokenStore(new JdbcReplyTokenRepository(dataSource), clock);
        var alerts = new AlertLog(new JdbcAlertRepository(dataSource), new JdbcModLogRepository(dataSource),
                channel, config.adminChannel(), clock, auditWriter, metrics);
        var rateLimiter = new RateLimiter(new JdbcRateLimitRepository(dataSource), config.rateLimit(),
                config.operatorId(), alerts, clock, metrics);
        var messages = new JdbcMessageRepository(dataSource);
        var relay = new MessageRelay(messages, identities, tokens, new SentimentClassifier(lexicon), alerts,
                channel, config, clock, metrics);
        var analytics = new AnalyticsAggregator(messages, clock);

        var gateway = new RelayGateway(identities, tokens, rateLimiter, relay, alerts, analytics,
                new ConversationSessions(), channel, config);
        telegram.start(gateway);
        log.info("Relay started: moderation={}, publish channel={}", config.moderationEnabled(),
                config.hasPublishChannel() ? config.publishChannel() : "none");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            telegram.stop();
            shutdown(workers);
            shutdown(auditWriter);
            shutdown(outbound);
        }, "relay-shutdown"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            var t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
