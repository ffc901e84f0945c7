package com.anonrelay.gateway;

import com.anonrelay.analytics.AnalyticsAggregator;
import com.anonrelay.identity.IdentityRegistry;
import com.anonrelay.moderation.AlertLog;
import com.anonrelay.observability.RelayMetrics;
import com.anonrelay.ratelimit.RateDecision;
import com.anonrelay.ratelimit.RateLimiter;
import com.anonrelay.relay.MessageRelay;
import com.anonrelay.sentiment.Lexicon;
import com.anonrelay.sentiment.SentimentClassifier;
import com.anonrelay.shared.config.AnonRelayConfig;
import com.anonrelay.shared.config.RateLimitConfig;
import com.anonrelay.shared.model.AlertType;
import com.anonrelay.shared.model.ConversationEvent;
import com.anonrelay.shared.model.MessageContent;
import com.anonrelay.shared.model.ModAction;
import com.anonrelay.shared.model.OutboundAction;
import com.anonrelay.shared.model.OutboundMessage;
import com.anonrelay.testing.InMemoryAlertRepository;
import com.anonrelay.testing.InMemoryMessageRepository;
import com.anonrelay.testing.InMemoryModLogRepository;
import com.anonrelay.testing.InMemoryRateLimitRepository;
import com.anonrelay.testing.InMemoryReplyTokenRepository;
import com.anonrelay.testing.InMemoryUserRepository;
import com.anonrelay.testing.MutableClock;
import com.anonrelay.testing.RecordingChannel;
import com.anonrelay.tokens.ReplyTokenStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RelayGatewayTest {

    private static final long OPERATOR = 999;
    private static final long ALICE = 1001;
    private static final long BOB = 1002;

    private MutableClock clock;
    private RecordingChannel channel;
    private InMemoryModLogRepository modLog;
    private IdentityRegistry identities;
    private ReplyTokenStore tokens;
    private AlertLog alerts;
    private RelayMetrics metrics;
    private InMemoryMessageRepository messages;
    private ConversationSessions sessions;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(LocalDateTime.of(2026, 3, 1, 12, 0));
        channel = new RecordingChannel();
        modLog = new InMemoryModLogRepository();
        metrics = new RelayMetrics();
        identities = new IdentityRegistry(new InMemoryUserRepository(), clock);
        tokens = new ReplyTokenStore(new InMemoryReplyTokenRepository(), clock);
        alerts = new AlertLog(new InMemoryAlertRepository(), modLog, channel, "admin", clock, Runnable::run, metrics);
        messages = new InMemoryMessageRepository();
        sessions = new ConversationSessions();
    }

    @Test
    void startWithoutPayloadShowsOnboarding() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        gateway.onStart(ALICE, "alice", null);

        var alice = identities.getOrCreate(ALICE, "alice");
        var reply = last(ALICE);
        assertThat(reply.text()).contains("👋 Welcome!").contains("https://t.me/relay_bot?start=" + alice.publicCode());
        assertThat(reply.actions()).extracting(OutboundAction::data).containsExactly("my_link", "stats", "history:0");
    }

    @Test
    void operatorOnboardingShowsQueue() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        gateway.onStart(OPERATOR, "admin", null);

        var reply = last(OPERATOR);
        assertThat(reply.text()).contains("👑 Admin | Pending: 0");
        assertThat(reply.actions()).extracting(OutboundAction::data)
                .contains("admin_stats", "mod_log", "alerts", "urgent");
    }

    @Test
    void linkOpensComposeAndMessageGoesToModeration() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var bob = identities.getOrCreate(BOB, "bob");

        gateway.onStart(ALICE, "alice", bob.publicCode());
        assertThat(last(ALICE).text()).startsWith("✍️ Write an anonymous message");
        assertThat(last(ALICE).actions()).extracting(OutboundAction::data).containsExactly("cancel");

        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "привет"));

        assertThat(last(ALICE).text()).startsWith("✅ Message sent to moderation.");
        assertEquals(1, channel.sentTo("admin").size());
        assertTrue(sessions.get(ALICE).isEmpty());

        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "ещё"));
        assertThat(last(ALICE).text()).startsWith("Open someone's link first");
        assertEquals(1, channel.sentTo("admin").size());
    }

    @Test
    void unmoderatedMessageIsAcknowledgedAsSent() {
        var gateway = gateway(config(false, RateLimitConfig.defaults()));
        var bob = identities.getOrCreate(BOB, "bob");

        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "привет"));

        assertEquals("✅ Message sent!", last(ALICE).text());
        assertThat(last(BOB).text()).startsWith("📨 Anonymous message:");
    }

    @Test
    void ownLinkIsRefused() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var alice = identities.getOrCreate(ALICE, "alice");

        gateway.onStart(ALICE, "alice", alice.publicCode());

        assertThat(last(ALICE).text()).startsWith("🙈 You can't send a message to yourself!");
        assertTrue(sessions.get(ALICE).isEmpty());
    }

    @Test
    void operatorMayMessageThemselves() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var operator = identities.getOrCreate(OPERATOR, "admin");

        gateway.onStart(OPERATOR, "admin", operator.publicCode());

        assertTrue(sessions.get(OPERATOR).isPresent());
    }

    @Test
    void unknownCodeFallsBackToOnboarding() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        gateway.onStart(ALICE, "alice", "nosuchcode");

        assertThat(last(ALICE).text()).contains("👋 Welcome!");
        assertTrue(sessions.get(ALICE).isEmpty());
    }

    @Test
    void rateLimitedMessageIsRefused() {
        var gateway = gateway(config(true, new RateLimitConfig(1, 60, 20, 24)));
        var bob = identities.getOrCreate(BOB, "bob");

        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "один"));
        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "два"));

        assertEquals("⏳ Limit reached: 1 messages per window. Try again later.", last(ALICE).text());
        assertEquals(1, channel.sentTo("admin").size());
        assertTrue(sessions.get(ALICE).isEmpty());
    }

    @Test
    void operatorBlockStopsSender() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var alice = identities.getOrCreate(ALICE, "alice");
        var bob = identities.getOrCreate(BOB, "bob");

        var answer = gateway.onCallback(OPERATOR, "admin", "block:" + alice.internalId() + ":2");

        assertEquals("✅ User blocked for 2h", answer);
        assertEquals("🚫 You have been blocked for 2 hours.", last(ALICE).text());
        assertEquals(1, modLog.count(ModAction.BLOCK));

        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "привет"));
        assertEquals("🚫 You are blocked until 01.03 14:00", last(ALICE).text());

        assertEquals("✅ User unblocked", gateway.onCallback(OPERATOR, "admin", "unblock:" + alice.internalId()));
        assertEquals(1, modLog.count(ModAction.UNBLOCK));
    }

    @Test
    void moderationCallbacksAreOperatorOnly() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var bob = identities.getOrCreate(BOB, "bob");
        var id = relay(config(true, RateLimitConfig.defaults()))
                .submit(identities.getOrCreate(ALICE, "alice").internalId(), bob.internalId(),
                        MessageContent.text("привет"), null).id();

        assertEquals("❌ No access", gateway.onCallback(ALICE, "alice", "approve:" + id));
        assertEquals("❌ No access", gateway.onCallback(ALICE, "alice", "block:1:24"));
        assertEquals("❌ No access", gateway.onCallback(ALICE, "alice", "admin_stats"));

        assertEquals("✅ Approved and published", gateway.onCallback(OPERATOR, "admin", "approve:" + id));
        assertEquals("⚠️ Message already processed", gateway.onCallback(OPERATOR, "admin", "reject:" + id));
        assertEquals("❌ Not found", gateway.onCallback(OPERATOR, "admin", "approve:404"));
    }

    @Test
    void receiverCanReplyThroughToken() {
        var config = config(false, RateLimitConfig.defaults());
        var gateway = gateway(config);
        var bob = identities.getOrCreate(BOB, "bob");

        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "вопрос"));
        var replyData = last(BOB).actions().stream()
                .map(OutboundAction::data)
                .filter(d -> d.startsWith("r_"))
                .findFirst().orElseThrow();

        assertNull(gateway.onCallback(BOB, "bob", replyData));
        assertThat(last(BOB).text()).startsWith("✍️ Write your reply.");
        assertTrue(sessions.get(BOB).orElseThrow().replyMode());

        gateway.onMessage(ConversationEvent.text(BOB, "bob", "ответ"));

        assertEquals("✅ Message sent!", last(BOB).text());
        assertThat(channel.sentTo(String.valueOf(ALICE))).anyMatch(s -> s.message().text().contains("ответ"));
    }

    @Test
    void readCallbackMarksMessage() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var relay = relay(config(false, RateLimitConfig.defaults()));
        var id = relay.submit(identities.getOrCreate(ALICE, "alice").internalId(),
                identities.getOrCreate(BOB, "bob").internalId(), MessageContent.text("привет"), null).id();

        assertEquals("✅ Marked as read", gateway.onCallback(BOB, "bob", "read:" + id));
        assertTrue(messages.findById(id).orElseThrow().read());
        assertEquals("👁 Your message has been read!", last(ALICE).text());
    }

    @Test
    void readCallbackIsReceiverOnly() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var relay = relay(config(false, RateLimitConfig.defaults()));
        var id = relay.submit(identities.getOrCreate(ALICE, "alice").internalId(),
                identities.getOrCreate(BOB, "bob").internalId(), MessageContent.text("привет"), null).id();
        var toAlice = channel.sentTo(String.valueOf(ALICE)).size();

        assertEquals(RelayGateway.NO_ACCESS, gateway.onCallback(ALICE, "alice", "read:" + id));
        assertEquals(RelayGateway.NO_ACCESS, gateway.onCallback(OPERATOR, "admin", "read:" + id));

        assertFalse(messages.findById(id).orElseThrow().read());
        assertEquals(toAlice, channel.sentTo(String.valueOf(ALICE)).size());
    }

    @Test
    void replyFromDeliveryIsPublishedUnderOriginal() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var bob = identities.getOrCreate(BOB, "bob");
        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "вопрос"));
        var id = pendingId();
        gateway.onCallback(OPERATOR, "admin", "approve:" + id);
        var originalRef = messages.findById(id).orElseThrow().publishedRef();
        assertNotNull(originalRef);
        assertThat(last(BOB).actions()).extracting(OutboundAction::data).contains("reply:" + id);

        assertEquals(RelayGateway.NO_ACCESS, gateway.onCallback(ALICE, "alice", "reply:" + id));
        assertNull(gateway.onCallback(BOB, "bob", "reply:" + id));
        assertThat(last(BOB).text()).startsWith("✍️ Write your reply.");
        var session = sessions.get(BOB).orElseThrow();
        assertTrue(session.replyMode());
        assertEquals(id, session.replyToId());

        gateway.onMessage(ConversationEvent.text(BOB, "bob", "ответ"));
        var replyId = pendingId();
        assertEquals(id, messages.findById(replyId).orElseThrow().replyToId());
        gateway.onCallback(OPERATOR, "admin", "approve:" + replyId);

        var board = channel.sentTo("@board");
        var published = board.get(board.size() - 1).message();
        assertThat(published.text()).startsWith("↩️ Reply:").contains("ответ");
        assertEquals(originalRef, published.replyToRef());
        assertThat(channel.sentTo(String.valueOf(ALICE)))
                .anyMatch(s -> s.message().text().startsWith("↩️ Anonymous reply:"));
    }

    @Test
    void senderFollowsUpOnOwnPublishedMessage() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var bob = identities.getOrCreate(BOB, "bob");
        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "вопрос"));
        var id = pendingId();
        gateway.onCallback(OPERATOR, "admin", "approve:" + id);
        assertThat(last(ALICE).actions()).extracting(OutboundAction::data).containsExactly("user_reply:" + id);

        assertEquals(RelayGateway.NO_ACCESS, gateway.onCallback(BOB, "bob", "user_reply:" + id));
        assertNull(gateway.onCallback(ALICE, "alice", "user_reply:" + id));

        var session = sessions.get(ALICE).orElseThrow();
        assertEquals(bob.internalId(), session.targetUserId());
        assertEquals(id, session.replyToId());
    }

    @Test
    void joiningDiscussionNeedsPublishedMessage() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var bob = identities.getOrCreate(BOB, "bob");
        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "вопрос"));
        var id = pendingId();
        long carol = 1003;

        assertEquals("❌ Message is not published yet", gateway.onCallback(carol, "carol", "join_discussion:" + id));
        assertTrue(sessions.get(carol).isEmpty());

        gateway.onCallback(OPERATOR, "admin", "approve:" + id);
        var board = channel.sentTo("@board");
        assertThat(board.get(0).message().actions()).extracting(OutboundAction::data)
                .containsExactly("join_discussion:" + id);

        assertNull(gateway.onCallback(carol, "carol", "join_discussion:" + id));
        var session = sessions.get(carol).orElseThrow();
        assertEquals(bob.internalId(), session.targetUserId());
        assertEquals(id, session.replyToId());
        assertEquals("❌ Not found", gateway.onCallback(carol, "carol", "join_discussion:404"));
    }

    @Test
    void operatorReadsModerationLog() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        assertNull(gateway.onCallback(OPERATOR, "admin", "mod_log"));
        assertEquals("📋 Moderation log\n\nThe log is empty", last(OPERATOR).text());

        var bob = identities.getOrCreate(BOB, "bob");
        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "вопрос"));
        var id = pendingId();
        gateway.onCallback(OPERATOR, "admin", "approve:" + id);

        assertEquals(RelayGateway.NO_ACCESS, gateway.onCallback(ALICE, "alice", "mod_log"));
        assertNull(gateway.onCallback(OPERATOR, "admin", "mod_log"));
        assertThat(last(OPERATOR).text()).contains("✅ approve | ID:" + id + " | 2026-03-01 12:00");
    }

    @Test
    void operatorResolvesAlertFromList() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        alerts.raise(AlertType.NEAR_SPAM, 5L, "Rate limit hit: 15 msgs");
        var alertId = alerts.unresolved().get(0).id();

        assertEquals(RelayGateway.NO_ACCESS, gateway.onCallback(ALICE, "alice", "alerts"));
        assertNull(gateway.onCallback(OPERATOR, "admin", "alerts"));
        assertThat(last(OPERATOR).text()).contains("[near_spam] Rate limit hit: 15 msgs").contains("User:5");
        assertThat(last(OPERATOR).actions()).extracting(OutboundAction::data)
                .containsExactly("resolve_alert:" + alertId, "cancel");

        assertEquals(RelayGateway.NO_ACCESS, gateway.onCallback(ALICE, "alice", "resolve_alert:" + alertId));
        assertEquals("✅ Alert resolved", gateway.onCallback(OPERATOR, "admin", "resolve_alert:" + alertId));
        assertEquals("🚨 Active alerts\n\nNo active alerts ✅", last(OPERATOR).text());
        assertEquals("⚠️ Alert already resolved", gateway.onCallback(OPERATOR, "admin", "resolve_alert:" + alertId));
        assertTrue(alerts.unresolved().isEmpty());
    }

    @Test
    void operatorSeesUrgentQueue() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        gateway.onCallback(OPERATOR, "admin", "urgent");
        assertEquals("🔥 Urgent messages\n\nNo urgent messages ✅", last(OPERATOR).text());

        var id = relay(config(true, RateLimitConfig.defaults()))
                .submit(identities.getOrCreate(ALICE, "alice").internalId(),
                        identities.getOrCreate(BOB, "bob").internalId(), MessageContent.text("помогите мне"), null).id();

        assertEquals(RelayGateway.NO_ACCESS, gateway.onCallback(ALICE, "alice", "urgent"));
        gateway.onCallback(OPERATOR, "admin", "urgent");
        assertThat(last(OPERATOR).text()).contains("• ID:" + id + " | помогите мне");

        gateway.onCallback(OPERATOR, "admin", "reject:" + id);
        gateway.onCallback(OPERATOR, "admin", "urgent");
        assertThat(last(OPERATOR).text()).endsWith("No urgent messages ✅");
    }

    @Test
    void operatorAnswersSenderDirectly() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var bob = identities.getOrCreate(BOB, "bob");
        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "вопрос"));
        var id = pendingId();
        gateway.onCallback(OPERATOR, "admin", "reject:" + id);
        assertThat(last(OPERATOR).actions()).extracting(OutboundAction::data)
                .containsExactly("answer_dm:" + id, "answer_channel:" + id);

        assertEquals(RelayGateway.NO_ACCESS, gateway.onCallback(ALICE, "alice", "answer_dm:" + id));
        assertNull(gateway.onCallback(OPERATOR, "admin", "answer_dm:" + id));
        gateway.onMessage(ConversationEvent.text(OPERATOR, "admin", "please rephrase"));

        assertEquals("💬 Message from the moderator:\n\nplease rephrase", last(ALICE).text());
        assertEquals("✅ Message sent to the sender!", last(OPERATOR).text());
        assertEquals(1, modLog.count(ModAction.ANSWER_DM));
        assertTrue(sessions.get(OPERATOR).isEmpty());
        assertEquals(1, channel.sentTo("admin").size());
    }

    @Test
    void operatorAnswerOnBoardIsThreadedUnderMessage() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var bob = identities.getOrCreate(BOB, "bob");
        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "вопрос"));
        var id = pendingId();
        gateway.onCallback(OPERATOR, "admin", "approve:" + id);
        var originalRef = messages.findById(id).orElseThrow().publishedRef();

        assertNull(gateway.onCallback(OPERATOR, "admin", "answer_channel:" + id));
        gateway.onMessage(ConversationEvent.text(OPERATOR, "admin", "good question"));

        var board = channel.sentTo("@board");
        var answer = board.get(board.size() - 1).message();
        assertEquals("👑 Moderator answer:\n\ngood question", answer.text());
        assertEquals(originalRef, answer.replyToRef());
        assertEquals("✅ Answer published on the board!", last(OPERATOR).text());
        assertEquals(1, modLog.count(ModAction.ANSWER_CHANNEL));
    }

    @Test
    void failedOperatorAnswerIsReported() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var bob = identities.getOrCreate(BOB, "bob");
        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "вопрос"));
        var id = pendingId();
        channel.failFor(String.valueOf(ALICE));

        gateway.onCallback(OPERATOR, "admin", "answer_dm:" + id);
        gateway.onMessage(ConversationEvent.text(OPERATOR, "admin", "hello"));

        assertEquals("❌ Could not send the answer.", last(OPERATOR).text());
        assertEquals(0, modLog.count(ModAction.ANSWER_DM));
    }

    @Test
    void historyPagesThroughInbox() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var relay = relay(config(false, RateLimitConfig.defaults()));
        var alice = identities.getOrCreate(ALICE, "alice");
        var bob = identities.getOrCreate(BOB, "bob");
        for (int i = 0; i < RelayGateway.HISTORY_PAGE_SIZE + 1; i++) {
            relay.submit(alice.internalId(), bob.internalId(), MessageContent.text("msg " + i), null);
        }

        gateway.onCallback(BOB, "bob", "history:0");
        assertThat(last(BOB).text()).startsWith("📬 Messages (page 1)");
        assertThat(last(BOB).actions()).extracting(OutboundAction::data).containsExactly("history:1", "cancel");

        gateway.onCallback(BOB, "bob", "history:1");
        assertThat(last(BOB).text()).startsWith("📬 Messages (page 2)");
        assertThat(last(BOB).actions()).extracting(OutboundAction::data).containsExactly("history:0", "cancel");

        gateway.onCallback(ALICE, "alice", "history:0");
        assertEquals("📭 You have no messages yet.", last(ALICE).text());
    }

    @Test
    void statsShowApprovedCounts() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var relay = relay(config(false, RateLimitConfig.defaults()));
        relay.submit(identities.getOrCreate(ALICE, "alice").internalId(),
                identities.getOrCreate(BOB, "bob").internalId(), MessageContent.text("привет"), null);

        gateway.onCallback(BOB, "bob", "stats");

        assertEquals("📊 Your stats\n\n📥 Received: 1\n📤 Sent: 0", last(BOB).text());
    }

    @Test
    void operatorSeesAnalytics() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        assertNull(gateway.onCallback(OPERATOR, "admin", "admin_stats"));
        assertThat(last(OPERATOR).text()).startsWith("📈 Analytics").contains("Total: 0");
    }

    @Test
    void cancelClearsSession() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        var bob = identities.getOrCreate(BOB, "bob");
        gateway.onStart(ALICE, "alice", bob.publicCode());

        gateway.onCallback(ALICE, "alice", "cancel");

        assertTrue(sessions.get(ALICE).isEmpty());
        assertEquals("❌ Cancelled.", last(ALICE).text());
    }

    @Test
    void relayFailureAnswersGenerically() {
        var config = config(true, RateLimitConfig.defaults());
        var relay = mock(MessageRelay.class);
        when(relay.submit(anyLong(), anyLong(), any(), any())).thenThrow(new IllegalStateException("db down"));
        var gateway = new RelayGateway(identities, tokens, rateLimiter(config), relay, alerts,
                new AnalyticsAggregator(messages, clock), sessions, channel, config);
        var bob = identities.getOrCreate(BOB, "bob");

        gateway.onStart(ALICE, "alice", bob.publicCode());
        gateway.onMessage(ConversationEvent.text(ALICE, "alice", "привет"));

        assertEquals(RelayGateway.GENERIC_FAILURE, last(ALICE).text());
        assertTrue(sessions.get(ALICE).isEmpty());
    }

    @Test
    void malformedCallbackIsAnsweredGenerically() {
        var gateway = gateway(config(true, RateLimitConfig.defaults()));
        assertEquals(RelayGateway.GENERIC_FAILURE, gateway.onCallback(BOB, "bob", "read:abc"));
        assertNull(gateway.onCallback(BOB, "bob", "unknown"));
        assertNull(gateway.onCallback(BOB, "bob", " "));
    }

    @Test
    void denialTexts() {
        var until = LocalDateTime.of(2026, 3, 2, 9, 5);
        assertEquals("🚫 You are blocked until 02.03 09:05",
                RelayGateway.denialText(new RateDecision.Blocked(until)));
        assertEquals("🚫 You have been blocked for spam until 02.03 09:05",
                RelayGateway.denialText(new RateDecision.AutoBlocked(20, until)));
        assertEquals("⏳ Limit reached: 10 messages per window. Try again later.",
                RelayGateway.denialText(new RateDecision.RateLimited(11, 10)));
        assertThrows(IllegalArgumentException.class, () -> RelayGateway.denialText(new RateDecision.Allowed(1)));
    }

    private RelayGateway gateway(AnonRelayConfig config) {
        return new RelayGateway(identities, tokens, rateLimiter(config), relay(config), alerts,
                new AnalyticsAggregator(messages, clock), sessions, channel, config);
    }

    private MessageRelay relay(AnonRelayConfig config) {
        return new MessageRelay(messages, identities, tokens, new SentimentClassifier(Lexicon.defaults()), alerts,
                channel, config, clock, metrics);
    }

    private RateLimiter rateLimiter(AnonRelayConfig config) {
        return new RateLimiter(new InMemoryRateLimitRepository(), config.rateLimit(), OPERATOR, alerts, clock, metrics);
    }

    private long pendingId() {
        var queued = channel.sentTo("admin");
        return queued.get(queued.size() - 1).message().actions().stream()
                .map(OutboundAction::data)
                .filter(d -> d.startsWith("approve:"))
                .map(d -> Long.parseLong(d.substring("approve:".length())))
                .findFirst().orElseThrow();
    }

    private OutboundMessage last(long externalUserId) {
        var sent = channel.sentTo(String.valueOf(externalUserId));
        assertFalse(sent.isEmpty(), "nothing sent to " + externalUserId);
        return sent.get(sent.size() - 1).message();
    }

    private static AnonRelayConfig config(boolean moderation, RateLimitConfig rateLimit) {
        return new AnonRelayConfig("token", OPERATOR, "admin", "@board", moderation, true, "relay_bot",
                rateLimit, 10, 2, null);
    }
}
