package com.anonrelay.relay;

import com.anonrelay.channels.OutboundChannel;
import com.anonrelay.identity.IdentityRegistry;
import com.anonrelay.moderation.AlertLog;
import com.anonrelay.observability.RelayMetrics;
import com.anonrelay.sentiment.SentimentClassifier;
import com.anonrelay.shared.config.AnonRelayConfig;
import com.anonrelay.shared.error.AlreadyProcessedException;
import com.anonrelay.shared.error.DeliveryException;
import com.anonrelay.shared.error.NotFoundException;
import com.anonrelay.shared.error.ValidationException;
import com.anonrelay.shared.model.AlertType;
import com.anonrelay.shared.model.Message;
import com.anonrelay.shared.model.MessageContent;
import com.anonrelay.shared.model.MessageStatus;
import com.anonrelay.shared.model.ModAction;
import com.anonrelay.shared.model.OutboundAction;
import com.anonrelay.shared.model.OutboundMessage;
import com.anonrelay.tokens.DeepLink;
import com.anonrelay.tokens.ReplyTokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns the message lifecycle: {@code PENDING -> APPROVED | REJECTED}, both terminal.
 *
 * <p>Every state change is committed before any outbound call is made, and outbound calls hold no
 * lock. Publish and delivery failures are logged and never retried.</p>
 */
public class MessageRelay {

    private static final Logger log = LoggerFactory.getLogger(MessageRelay.class);
    static final int EXCERPT_LENGTH = 200;

    private final MessageRepository messages;
    private final IdentityRegistry identities;
    private final ReplyTokenStore tokens;
    private final SentimentClassifier classifier;
    private final AlertLog alerts;
    private final OutboundChannel channel;
    private final AnonRelayConfig config;
    private final Clock clock;
    private final RelayMetrics metrics;

    public MessageRelay(MessageRepository messages, IdentityRegistry identities, ReplyTokenStore tokens,
                        SentimentClassifier classifier, AlertLog alerts, OutboundChannel channel,
                        AnonRelayConfig config, Clock clock, RelayMetrics metrics) {
        this.messages = messages;
        this.identities = identities;
        this.tokens = tokens;
        this.classifier = classifier;
        this.alerts = alerts;
        this.channel = channel;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Classifies and stores a message. Urgent messages raise an alert right away, ahead of any
     * moderation decision.
     */
    public Message create(long senderId, long receiverId, MessageContent content, Long replyToId) {
        if (replyToId != null && messages.findById(replyToId).isEmpty()) {
            throw new NotFoundException("Message", replyToId);
        }
        var status = config.moderationEnabled() ? MessageStatus.PENDING : MessageStatus.APPROVED;
        var text = content.plainText();
        var classification = classifier.classify(text);

        var message = messages.insert(new NewMessage(senderId, receiverId, content, status, replyToId,
                classification.sentiment(), classification.urgent(), LocalDateTime.now(clock)));
        metrics.messagesCreated().increment();
        log.info("Message {} created: {} -> {} status={} sentiment={}",
                message.id(), senderId, receiverId, status, classification.sentiment());

        if (classification.urgent()) {
            alerts.raise(AlertType.URGENT, senderId, "Message #" + message.id() + "\n" + excerpt(text));
        }
        return message;
    }

    /**
     * Creates the message and routes it: to the moderation queue, or straight to publishing when
     * moderation is off.
     */
    public Message submit(long senderId, long receiverId, MessageContent content, Long replyToId) {
        var message = create(senderId, receiverId, content, replyToId);
        if (message.status() == MessageStatus.PENDING) {
            sendToModeration(message);
            return message;
        }
        return publishApproved(message, false);
    }

    /**
     * Applies a moderator decision. Exactly one caller can move a message out of {@code PENDING};
     * everyone else gets {@link AlreadyProcessedException}.
     */
    public Message transition(long messageId, ModerationDecision decision, long moderatorId) {
        var message = messages.findById(messageId)
                .orElseThrow(() -> new NotFoundException("Message", messageId));
        if (!messages.compareAndSetStatus(messageId, MessageStatus.PENDING, decision.target())) {
            var current = messages.findById(messageId).map(Message::status).orElse(message.status());
            throw new AlreadyProcessedException(messageId, current);
        }
        alerts.logModAction(moderatorId, decision.action(), messageId, message.senderId(), null);
        metrics.messagesModerated(decision.action().code()).increment();
        log.info("Message {} {} by moderator {}", messageId, decision.target(), moderatorId);

        var updated = message.withStatus(decision.target());
        if (decision == ModerationDecision.APPROVE) {
            return publishApproved(updated, true);
        }
        notifyUser(updated.senderId(), "❌ Your message was rejected by the moderator.");
        return updated;
    }

    /** First read only: stores the read time and, for anonymous DMs, tells the sender. */
    public void markRead(long messageId) {
        var message = messages.findById(messageId)
                .orElseThrow(() -> new NotFoundException("Message", messageId));
        if (message.read()) return;
        if (!messages.markRead(messageId, LocalDateTime.now(clock))) return;

        if (tokens.existsForPair(message.senderId(), message.receiverId())) {
            notifyUser(message.senderId(), "👁 Your message has been read!");
        }
    }

    /**
     * Sends the message to its receiver together with a fresh reply token, so the receiver can
     * answer without learning who the sender is.
     *
     * @throws DeliveryException when the transport fails or times out
     */
    public void deliverAnonymous(long messageId, long receiverId, long senderId) {
        var message = messages.findById(messageId)
                .orElseThrow(() -> new NotFoundException("Message", messageId));
        var receiver = identities.requireById(receiverId);
        var payload = DeepLink.replyPayload(tokens.issue(senderId, receiverId));

        var text = new StringBuilder(message.isReply() ? "↩️ Anonymous reply:" : "📨 Anonymous message:")
                .append("\n\n").append(message.content().plainText());
        if (config.botUsername() != null && !config.botUsername().isBlank()) {
            text.append("\n\n").append(DeepLink.startUrl(config.botUsername(), payload));
        }
        var actions = List.of(
                new OutboundAction("👁 Mark as read", "read:" + messageId),
                new OutboundAction("↩️ Reply", "reply:" + messageId),
                new OutboundAction("🔗 Reply link", payload));
        channel.deliver(String.valueOf(receiver.externalId()),
                new OutboundMessage(text.toString(), media(message.content()), null, actions));
        log.info("Delivered message {} to user {}", messageId, receiverId);
    }

    /**
     * Sends a moderator's private note to the sender of a message.
     *
     * @throws DeliveryException when the transport fails or times out
     */
    public void answerDirect(long moderatorId, long messageId, MessageContent content) {
        var message = get(messageId);
        var sender = identities.requireById(message.senderId());
        channel.deliver(String.valueOf(sender.externalId()), new OutboundMessage(
                "💬 Message from the moderator:\n\n" + content.plainText(), media(content), null, List.of()));
        alerts.logModAction(moderatorId, ModAction.ANSWER_DM, messageId, message.senderId(), null);
        log.info("Moderator {} answered the sender of message {} directly", moderatorId, messageId);
    }

    /**
     * Publishes a moderator's answer on the board, threaded under the message when it was published.
     *
     * @return the board reference of the answer, or {@code null} when the transport gave none
     * @throws DeliveryException when the transport fails or times out
     */
    public String answerPublicly(long moderatorId, long messageId, MessageContent content) {
        if (!config.hasPublishChannel()) throw new ValidationException("No publish channel configured");
        var message = get(messageId);
        var out = new OutboundMessage("👑 Moderator answer:\n\n" + content.plainText(), media(content),
                message.publishedRef(), List.of());
        var ref = channel.deliver(config.publishChannel(), out).orElse(null);
        alerts.logModAction(moderatorId, ModAction.ANSWER_CHANNEL, messageId, message.senderId(), null);
        log.info("Moderator {} answered message {} on the board", moderatorId, messageId);
        return ref;
    }

    public Message get(long messageId) {
        return messages.findById(messageId).orElseThrow(() -> new NotFoundException("Message", messageId));
    }

    public List<Message> inbox(long userId, int limit, int offset) {
        return messages.findApprovedForReceiver(userId, limit, offset);
    }

    public List<Message> urgentPending() {
        return messages.findUrgentPending();
    }

    public long pendingCount() {
        return messages.countByStatus().getOrDefault(MessageStatus.PENDING, 0L);
    }

    private Message publishApproved(Message message, boolean notifySender) {
        var published = message;
        var ref = publish(message);
        if (ref != null && messages.setPublishedRef(message.id(), ref)) {
            published = message.withPublishedRef(ref);
        }
        if (config.directDelivery()) {
            try {
                deliverAnonymous(message.id(), message.receiverId(), message.senderId());
            } catch (DeliveryException e) {
                metrics.deliveryFailures().increment();
                log.error("Failed to deliver message {} to user {}", message.id(), message.receiverId(), e);
            }
        }
        if (notifySender) {
            var actions = published.publishedRef() != null
                    ? List.of(new OutboundAction("💬 Reply on the board", "user_reply:" + message.id()))
                    : List.<OutboundAction>of();
            notifyUser(message.senderId(), OutboundMessage.text("✅ Your message was approved and published!", actions));
        }
        return published;
    }

    private String publish(Message message) {
        if (!config.hasPublishChannel()) return null;
        String replyToRef = null;
        if (message.replyToId() != null) {
            replyToRef = messages.findById(message.replyToId()).map(Message::publishedRef).orElse(null);
        }
        var prefix = message.isReply() ? "↩️ Reply:" : "📨 Anonymous message:";
        var out = new OutboundMessage(prefix + "\n\n" + message.content().plainText(),
                media(message.content()), replyToRef,
                List.of(new OutboundAction("💬 Join the discussion", "join_discussion:" + message.id())));
        try {
            return channel.deliver(config.publishChannel(), out).orElse(null);
        } catch (DeliveryException e) {
            metrics.deliveryFailures().increment();
            log.error("Failed to publish message {}", message.id(), e);
            return null;
        }
    }

    private void sendToModeration(Message message) {
        var sentToday = messages.countSentSince(message.senderId(), LocalDate.now(clock).atStartOfDay());
        var text = new StringBuilder();
        if (message.urgent()) text.append("🔥 URGENT!\n");
        text.append(message.isReply() ? "↩️ Reply awaiting moderation" : "📨 New message awaiting moderation")
                .append("\n\n");
        var body = message.content().plainText();
        if (!body.isEmpty()) text.append(body).append("\n\n");
        text.append("ID: ").append(message.id()).append(" | From: ").append(message.senderId()).append('\n')
                .append("Today: ").append(sentToday).append(" | ").append(message.sentiment());
        if (message.replyToId() != null) text.append(" | Reply to: ").append(message.replyToId());

        var actions = new ArrayList<OutboundAction>();
        actions.add(new OutboundAction("✅ Approve", "approve:" + message.id()));
        actions.add(new OutboundAction("❌ Reject", "reject:" + message.id()));
        actions.add(new OutboundAction("🚫 Block 24h", "block:" + message.senderId() + ":24"));
        try {
            channel.deliver(config.adminChannel(),
                    new OutboundMessage(text.toString(), media(message.content()), null, actions));
        } catch (DeliveryException e) {
            metrics.deliveryFailures().increment();
            log.error("Failed to post message {} to moderation", message.id(), e);
        }
    }

    private void notifyUser(long userId, String text) {
        notifyUser(userId, OutboundMessage.text(text));
    }

    private void notifyUser(long userId, OutboundMessage message) {
        try {
            var user = identities.requireById(userId);
            channel.deliver(String.valueOf(user.externalId()), message);
        } catch (DeliveryException | NotFoundException e) {
            metrics.deliveryFailures().increment();
            log.error("Failed to notify user {}: {}", userId, e.getMessage());
        }
    }

    private static MessageContent.Media media(MessageContent content) {
        return content instanceof MessageContent.Media m ? m : null;
    }

    static String excerpt(String text) {
        return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH);
    }
}
