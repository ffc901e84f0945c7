package com.anonrelay.gateway;

import com.anonrelay.analytics.AnalyticsAggregator;
import com.anonrelay.channels.InboundSink;
import com.anonrelay.channels.OutboundChannel;
import com.anonrelay.identity.IdentityRegistry;
import com.anonrelay.moderation.AlertLog;
import com.anonrelay.ratelimit.RateDecision;
import com.anonrelay.ratelimit.RateLimiter;
import com.anonrelay.relay.MessageRelay;
import com.anonrelay.relay.ModerationDecision;
import com.anonrelay.shared.config.AnonRelayConfig;
import com.anonrelay.shared.error.AlreadyProcessedException;
import com.anonrelay.shared.error.DeliveryException;
import com.anonrelay.shared.error.NotFoundException;
import com.anonrelay.shared.error.ValidationException;
import com.anonrelay.shared.model.Alert;
import com.anonrelay.shared.model.ConversationEvent;
import com.anonrelay.shared.model.Message;
import com.anonrelay.shared.model.MessageStatus;
import com.anonrelay.shared.model.ModAction;
import com.anonrelay.shared.model.ModLogEntry;
import com.anonrelay.shared.model.OutboundAction;
import com.anonrelay.shared.model.OutboundMessage;
import com.anonrelay.shared.model.User;
import com.anonrelay.tokens.DeepLink;
import com.anonrelay.tokens.ReplyTokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Event boundary between the transport and the relay. Every inbound event is handled in
 * isolation: any failure is logged with the user's id and answered with one generic notice.
 */
public class RelayGateway implements InboundSink {

    private static final Logger log = LoggerFactory.getLogger(RelayGateway.class);
    private static final DateTimeFormatter UNTIL_FORMAT = DateTimeFormatter.ofPattern("dd.MM HH:mm");
    private static final DateTimeFormatter LOG_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final String REPLY_PROMPT = "✍️ Write your reply. Text, photo, video, voice or sticker.";
    static final int HISTORY_PAGE_SIZE = 5;
    static final int MOD_LOG_SIZE = 20;
    static final int URGENT_SHOWN = 10;
    static final String NO_ACCESS = "❌ No access";
    static final String GENERIC_FAILURE = "❌ Something went wrong. Please try again.";

    private final IdentityRegistry identities;
    private final ReplyTokenStore tokens;
    private final RateLimiter rateLimiter;
    private final MessageRelay relay;
    private final AlertLog alerts;
    private final AnalyticsAggregator analytics;
    private final ConversationSessions sessions;
    private final OutboundChannel channel;
    private final AnonRelayConfig config;

    public RelayGateway(IdentityRegistry identities, ReplyTokenStore tokens, RateLimiter rateLimiter,
                        MessageRelay relay, AlertLog alerts, AnalyticsAggregator analytics,
                        ConversationSessions sessions, OutboundChannel channel, AnonRelayConfig config) {
        this.identities = identities;
        this.tokens = tokens;
        this.rateLimiter = rateLimiter;
        this.relay = relay;
        this.alerts = alerts;
        this.analytics = analytics;
        this.sessions = sessions;
        this.channel = channel;
        this.config = config;
    }

    @Override
    public void onStart(long externalUserId, String displayName, String payload) {
        try {
            var user = identities.getOrCreate(externalUserId, displayName);
            sessions.clear(externalUserId);
            var link = DeepLink.parse(payload);
            if (link instanceof DeepLink.Reply reply) {
                var token = tokens.resolve(reply.token());
                if (token.isPresent()) {
                    sessions.reply(externalUserId, token.get().senderId(), null);
                    send(externalUserId, OutboundMessage.text(REPLY_PROMPT, cancelAction()));
                    return;
                }
            } else if (link instanceof DeepLink.ToUser toUser) {
                var target = identities.lookupByCode(toUser.code());
                if (target.isPresent()) {
                    if (target.get().internalId() == user.internalId() && !isOperator(externalUserId)) {
                        send(externalUserId, OutboundMessage.text(
                                "🙈 You can't send a message to yourself!\n\nShare your link with friends.",
                                mainActions(externalUserId)));
                        return;
                    }
                    sessions.compose(externalUserId, target.get().internalId());
                    send(externalUserId, OutboundMessage.text(
                            "✍️ Write an anonymous message. Text, photo, video, voice or sticker.\n\n"
                                    + "The receiver will not know who sent it.", cancelAction()));
                    return;
                }
            }
            onboarding(user);
        } catch (RuntimeException e) {
            fail(externalUserId, "start", e);
        }
    }

    @Override
    public void onMessage(ConversationEvent event) {
        var externalUserId = event.externalUserId();
        try {
            var user = identities.getOrCreate(externalUserId, event.displayName());
            var session = sessions.get(externalUserId);
            if (session.isEmpty()) {
                send(externalUserId, OutboundMessage.text(
                        "Open someone's link first to send them an anonymous message.", mainActions(externalUserId)));
                return;
            }

            var target = session.get();
            if (target.moderatorAnswer()) {
                sessions.clear(externalUserId);
                answer(user, target, event);
                return;
            }

            var decision = rateLimiter.check(user);
            if (!decision.allowed()) {
                sessions.clear(externalUserId);
                send(externalUserId, OutboundMessage.text(denialText(decision), mainActions(externalUserId)));
                return;
            }

            var message = relay.submit(user.internalId(), target.targetUserId(), event.content(), target.replyToId());
            sessions.clear(externalUserId);
            var ack = message.status() == MessageStatus.PENDING
                    ? "✅ Message sent to moderation.\nYou will be notified after review."
                    : "✅ Message sent!";
            send(externalUserId, OutboundMessage.text(ack, mainActions(externalUserId)));
        } catch (RuntimeException e) {
            sessions.clear(externalUserId);
            fail(externalUserId, "message", e);
        }
    }

    @Override
    public String onCallback(long externalUserId, String displayName, String data) {
        if (data == null || data.isBlank()) return null;
        try {
            var user = identities.getOrCreate(externalUserId, displayName);
            if (data.startsWith(DeepLink.REPLY_PREFIX)) {
                onStart(externalUserId, displayName, data);
                return null;
            }
            var parts = data.split(":");
            switch (parts[0]) {
                case "approve":
                    return moderate(user, parts, ModerationDecision.APPROVE);
                case "reject":
                    return moderate(user, parts, ModerationDecision.REJECT);
                case "read":
                    return markRead(user, parts);
                case "reply":
                    return startReply(user, parts);
                case "user_reply":
                    return startBoardReply(user, parts);
                case "join_discussion":
                    return joinDiscussion(user, parts);
                case "answer_dm":
                    return startAnswer(user, parts, ConversationSessions.Mode.ANSWER_DIRECT);
                case "answer_channel":
                    return startAnswer(user, parts, ConversationSessions.Mode.ANSWER_PUBLIC);
                case "block":
                    return block(user, parts);
                case "unblock":
                    return unblock(user, parts);
                case "my_link":
                    send(externalUserId, OutboundMessage.text(linkText(user), mainActions(externalUserId)));
                    return null;
                case "stats":
                    var stats = analytics.userStats(user.internalId());
                    send(externalUserId, OutboundMessage.text("📊 Your stats\n\n📥 Received: " + stats.received()
                            + "\n📤 Sent: " + stats.sent(), mainActions(externalUserId)));
                    return null;
                case "history":
                    history(user, parts.length > 1 ? Integer.parseInt(parts[1]) : 0);
                    return null;
                case "admin_stats":
                    if (!isOperator(externalUserId)) return NO_ACCESS;
                    send(externalUserId, OutboundMessage.text(summaryText(), mainActions(externalUserId)));
                    return null;
                case "mod_log":
                    if (!isOperator(externalUserId)) return NO_ACCESS;
                    send(externalUserId, OutboundMessage.text(modLogText(alerts.recent(MOD_LOG_SIZE)), menuAction()));
                    return null;
                case "alerts":
                    if (!isOperator(externalUserId)) return NO_ACCESS;
                    showAlerts(externalUserId);
                    return null;
                case "resolve_alert":
                    if (!isOperator(externalUserId)) return NO_ACCESS;
                    if (!alerts.resolve(parseId(parts, 1))) return "⚠️ Alert already resolved";
                    showAlerts(externalUserId);
                    return "✅ Alert resolved";
                case "urgent":
                    if (!isOperator(externalUserId)) return NO_ACCESS;
                    send(externalUserId, OutboundMessage.text(urgentText(relay.urgentPending()), menuAction()));
                    return null;
                case "cancel":
                    sessions.clear(externalUserId);
                    send(externalUserId, OutboundMessage.text("❌ Cancelled.", mainActions(externalUserId)));
                    return null;
                default:
                    log.debug("Ignoring unknown callback '{}' from user {}", data, externalUserId);
                    return null;
            }
        } catch (NotFoundException e) {
            return "❌ Not found";
        } catch (AlreadyProcessedException e) {
            return "⚠️ Message already processed";
        } catch (RuntimeException e) {
            log.error("Failed to handle callback '{}' from user {}", data, externalUserId, e);
            return GENERIC_FAILURE;
        }
    }

    private String moderate(User moderator, String[] parts, ModerationDecision decision) {
        if (!isOperator(moderator.externalId())) return NO_ACCESS;
        var message = relay.transition(parseId(parts, 1), decision, moderator.internalId());
        var answerActions = new ArrayList<OutboundAction>();
        answerActions.add(new OutboundAction("💬 Answer in DM", "answer_dm:" + message.id()));
        if (config.hasPublishChannel()) {
            answerActions.add(new OutboundAction("📢 Answer on the board", "answer_channel:" + message.id()));
        }
        send(moderator.externalId(), OutboundMessage.text(
                "Message #" + message.id() + " is " + message.status().name().toLowerCase(Locale.ROOT) + ".",
                answerActions));
        return decision == ModerationDecision.APPROVE
                ? "✅ Approved" + (message.publishedRef() != null ? " and published" : "")
                : "❌ Rejected";
    }

    private String block(User moderator, String[] parts) {
        if (!isOperator(moderator.externalId())) return NO_ACCESS;
        long targetId = parseId(parts, 1);
        int hours = parts.length > 2 ? Integer.parseInt(parts[2]) : config.rateLimit().autoBlockHours();
        var target = identities.requireById(targetId);
        rateLimiter.block(targetId, hours);
        alerts.logModAction(moderator.internalId(), ModAction.BLOCK, null, targetId, hours + "h");
        send(target.externalId(), OutboundMessage.text("🚫 You have been blocked for " + hours + " hours."));
        return "✅ User blocked for " + hours + "h";
    }

    private String unblock(User moderator, String[] parts) {
        if (!isOperator(moderator.externalId())) return NO_ACCESS;
        long targetId = parseId(parts, 1);
        identities.requireById(targetId);
        rateLimiter.unblock(targetId);
        alerts.logModAction(moderator.internalId(), ModAction.UNBLOCK, null, targetId, null);
        return "✅ User unblocked";
    }

    private String markRead(User user, String[] parts) {
        var message = relay.get(parseId(parts, 1));
        if (message.receiverId() != user.internalId()) return NO_ACCESS;
        relay.markRead(message.id());
        return "✅ Marked as read";
    }

    /** The receiver answers the sender, threaded under the message. */
    private String startReply(User user, String[] parts) {
        var message = relay.get(parseId(parts, 1));
        if (message.receiverId() != user.internalId()) return NO_ACCESS;
        sessions.reply(user.externalId(), message.senderId(), message.id());
        send(user.externalId(), OutboundMessage.text(REPLY_PROMPT, cancelAction()));
        return null;
    }

    /** The sender follows up on their own published message. */
    private String startBoardReply(User user, String[] parts) {
        var message = relay.get(parseId(parts, 1));
        if (message.senderId() != user.internalId()) return NO_ACCESS;
        sessions.reply(user.externalId(), message.receiverId(), message.id());
        send(user.externalId(), OutboundMessage.text(
                "💬 Write your reply for the board. It will be posted under your message.", cancelAction()));
        return null;
    }

    private String joinDiscussion(User user, String[] parts) {
        var message = relay.get(parseId(parts, 1));
        if (message.publishedRef() == null) return "❌ Message is not published yet";
        sessions.reply(user.externalId(), message.receiverId(), message.id());
        send(user.externalId(), OutboundMessage.text(
                "💬 Write your comment for the discussion. It will be posted as a reply.", cancelAction()));
        return null;
    }

    private String startAnswer(User moderator, String[] parts, ConversationSessions.Mode mode) {
        if (!isOperator(moderator.externalId())) return NO_ACCESS;
        var message = relay.get(parseId(parts, 1));
        sessions.answer(moderator.externalId(), mode, message.senderId(), message.id());
        var prompt = mode == ConversationSessions.Mode.ANSWER_DIRECT
                ? "💬 Write a message for the sender. It will arrive as a note from the moderator."
                : "📢 Write an answer for the board. It will be posted as the moderator's answer.";
        send(moderator.externalId(), OutboundMessage.text(prompt, cancelAction()));
        return null;
    }

    private void answer(User moderator, ConversationSessions.Session session, ConversationEvent event) {
        String ack;
        try {
            if (session.mode() == ConversationSessions.Mode.ANSWER_DIRECT) {
                relay.answerDirect(moderator.internalId(), session.replyToId(), event.content());
                ack = "✅ Message sent to the sender!";
            } else {
                relay.answerPublicly(moderator.internalId(), session.replyToId(), event.content());
                ack = "✅ Answer published on the board!";
            }
        } catch (DeliveryException e) {
            log.warn("Failed to deliver moderator answer for message {}: {}", session.replyToId(), e.getMessage());
            ack = "❌ Could not send the answer.";
        }
        send(moderator.externalId(), OutboundMessage.text(ack, mainActions(moderator.externalId())));
    }

    private void showAlerts(long externalUserId) {
        var open = alerts.unresolved();
        var text = new StringBuilder("🚨 Active alerts\n\n");
        var actions = new ArrayList<OutboundAction>();
        if (open.isEmpty()) text.append("No active alerts ✅");
        for (Alert alert : open) {
            text.append("• [").append(alert.type().code()).append("] ")
                    .append(alert.details() == null ? "" : alert.details())
                    .append("\n  ID:").append(alert.id())
                    .append(" | User:").append(alert.userId() == null ? "-" : alert.userId())
                    .append("\n\n");
            actions.add(new OutboundAction("✅ Resolve #" + alert.id(), "resolve_alert:" + alert.id()));
        }
        actions.addAll(menuAction());
        send(externalUserId, OutboundMessage.text(text.toString().strip(), actions));
    }

    static String modLogText(List<ModLogEntry> entries) {
        var text = new StringBuilder("📋 Moderation log\n\n");
        if (entries.isEmpty()) return text.append("The log is empty").toString();
        for (var entry : entries) {
            text.append(actionIcon(entry.action())).append(' ').append(entry.action().code())
                    .append(" | ID:").append(entry.messageId() == null ? "-" : entry.messageId())
                    .append(" | ").append(entry.createdAt().format(LOG_FORMAT)).append('\n');
        }
        return text.toString().strip();
    }

    static String urgentText(List<Message> urgent) {
        var text = new StringBuilder("🔥 Urgent messages\n\n");
        if (urgent.isEmpty()) return text.append("No urgent messages ✅").toString();
        for (var m : urgent.subList(0, Math.min(urgent.size(), URGENT_SHOWN))) {
            text.append("• ID:").append(m.id()).append(" | ").append(preview(m)).append('\n');
        }
        return text.toString().strip();
    }

    private static String actionIcon(ModAction action) {
        return switch (action) {
            case APPROVE -> "✅";
            case REJECT -> "❌";
            case BLOCK -> "🚫";
            case UNBLOCK -> "🔓";
            case ANSWER_DM -> "💬";
            case ANSWER_CHANNEL -> "📢";
        };
    }

    private void history(User user, int page) {
        var page0 = Math.max(page, 0);
        var messages = relay.inbox(user.internalId(), HISTORY_PAGE_SIZE + 1, page0 * HISTORY_PAGE_SIZE);
        var hasMore = messages.size() > HISTORY_PAGE_SIZE;
        var shown = hasMore ? messages.subList(0, HISTORY_PAGE_SIZE) : messages;

        var text = new StringBuilder();
        if (shown.isEmpty()) {
            text.append("📭 You have no messages yet.");
        } else {
            text.append("📬 Messages (page ").append(page0 + 1).append(")\n\n");
            for (var m : shown) text.append(m.read() ? "✅ " : "🆕 ").append(preview(m)).append('\n');
        }
        var actions = new ArrayList<OutboundAction>();
        if (page0 > 0) actions.add(new OutboundAction("⬅️", "history:" + (page0 - 1)));
        if (hasMore) actions.add(new OutboundAction("➡️", "history:" + (page0 + 1)));
        actions.addAll(menuAction());
        send(user.externalId(), OutboundMessage.text(text.toString(), actions));
    }

    private void onboarding(User user) {
        var text = new StringBuilder("👋 Welcome!\n\n🔐 Send and receive anonymous messages.");
        if (config.botUsername() != null && !config.botUsername().isBlank()) {
            text.append("\n\n").append(linkText(user));
        }
        if (isOperator(user.externalId())) {
            text.append("\n\n👑 Admin | Pending: ").append(relay.pendingCount());
            var unresolved = alerts.unresolved().size();
            if (unresolved > 0) text.append(" | 🚨 Alerts: ").append(unresolved);
        }
        send(user.externalId(), OutboundMessage.text(text.toString(), mainActions(user.externalId())));
    }

    private String summaryText() {
        var s = analytics.summary();
        var text = new StringBuilder("📈 Analytics\n\n")
                .append("Total: ").append(s.total())
                .append("\nToday: ").append(s.today())
                .append("\nWeek: ").append(s.week())
                .append("\nPending: ").append(s.pending())
                .append("\nUrgent pending: ").append(s.urgentPending());
        s.sentiments().forEach((sentiment, count) -> text.append('\n').append(sentiment).append(": ").append(count));
        if (s.peakHour() != null) text.append("\n⏰ Peak hour: ").append(s.peakHour()).append(":00");
        return text.toString();
    }

    private String linkText(User user) {
        if (config.botUsername() == null || config.botUsername().isBlank()) {
            return "🔗 Your code: " + user.publicCode();
        }
        return "🔗 Your personal link:\n" + DeepLink.startUrl(config.botUsername(), user.publicCode());
    }

    static String denialText(RateDecision decision) {
        if (decision instanceof RateDecision.Blocked blocked) {
            return "🚫 You are blocked until " + blocked.until().format(UNTIL_FORMAT);
        }
        if (decision instanceof RateDecision.AutoBlocked blocked) {
            return "🚫 You have been blocked for spam until " + blocked.until().format(UNTIL_FORMAT);
        }
        if (decision instanceof RateDecision.RateLimited limited) {
            return "⏳ Limit reached: " + limited.limit() + " messages per window. Try again later.";
        }
        throw new IllegalArgumentException("Not a denial: " + decision);
    }

    private static String preview(Message message) {
        var content = message.content().plainText();
        if (content.isEmpty()) content = "[media]";
        return content.length() > 50 ? content.substring(0, 50) + "..." : content;
    }

    private List<OutboundAction> mainActions(long externalUserId) {
        var actions = new ArrayList<OutboundAction>();
        actions.add(new OutboundAction("🔗 My link", "my_link"));
        actions.add(new OutboundAction("📊 Stats", "stats"));
        actions.add(new OutboundAction("📬 Messages", "history:0"));
        if (isOperator(externalUserId)) {
            actions.add(new OutboundAction("📈 Analytics", "admin_stats"));
            actions.add(new OutboundAction("📋 Mod log", "mod_log"));
            actions.add(new OutboundAction("🚨 Alerts", "alerts"));
            actions.add(new OutboundAction("🔥 Urgent", "urgent"));
        }
        return actions;
    }

    private static List<OutboundAction> menuAction() {
        return List.of(new OutboundAction("🏠 Menu", "cancel"));
    }

    private static List<OutboundAction> cancelAction() {
        return List.of(new OutboundAction("❌ Cancel", "cancel"));
    }

    private static long parseId(String[] parts, int index) {
        if (parts.length <= index) throw new ValidationException("Missing id in callback");
        try {
            return Long.parseLong(parts[index]);
        } catch (NumberFormatException e) {
            throw new ValidationException("Bad id in callback: " + parts[index]);
        }
    }

    private boolean isOperator(long externalUserId) {
        return externalUserId == config.operatorId();
    }

    private void fail(long externalUserId, String what, RuntimeException e) {
        log.error("Failed to handle {} from user {}", what, externalUserId, e);
        send(externalUserId, OutboundMessage.text(GENERIC_FAILURE));
    }

    private void send(long externalUserId, OutboundMessage message) {
        try {
            channel.deliver(String.valueOf(externalUserId), message);
        } catch (DeliveryException e) {
            log.warn("Failed to reply to user {}: {}", externalUserId, e.getMessage());
        }
    }
}
