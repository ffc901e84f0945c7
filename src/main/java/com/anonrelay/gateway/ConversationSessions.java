package com.anonrelay.gateway;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user routing state between a link being opened and the next message arriving. Held in
 * memory only; a restart drops half-finished conversations.
 */
public class ConversationSessions {

    public enum Mode {
        COMPOSE,
        REPLY,
        /** Operator writing privately to the sender of {@code replyToId}. */
        ANSWER_DIRECT,
        /** Operator publishing an answer under {@code replyToId} on the board. */
        ANSWER_PUBLIC
    }

    public record Session(Mode mode, long targetUserId, Long replyToId) {
        public boolean replyMode() {
            return mode == Mode.REPLY;
        }

        public boolean moderatorAnswer() {
            return mode == Mode.ANSWER_DIRECT || mode == Mode.ANSWER_PUBLIC;
        }
    }

    private final Map<Long, Session> sessions = new ConcurrentHashMap<>();

    public void compose(long externalUserId, long targetUserId) {
        sessions.put(externalUserId, new Session(Mode.COMPOSE, targetUserId, null));
    }

    public void reply(long externalUserId, long targetUserId, Long replyToId) {
        sessions.put(externalUserId, new Session(Mode.REPLY, targetUserId, replyToId));
    }

    public void answer(long externalUserId, Mode mode, long senderId, long messageId) {
        if (mode != Mode.ANSWER_DIRECT && mode != Mode.ANSWER_PUBLIC) {
            throw new IllegalArgumentException("Not an answer mode: " + mode);
        }
        sessions.put(externalUserId, new Session(mode, senderId, messageId));
    }

    public Optional<Session> get(long externalUserId) {
        return Optional.ofNullable(sessions.get(externalUserId));
    }

    public void clear(long externalUserId) {
        sessions.remove(externalUserId);
    }
}
