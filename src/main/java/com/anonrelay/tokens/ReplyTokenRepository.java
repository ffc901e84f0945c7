package com.anonrelay.tokens;

import com.anonrelay.shared.model.ReplyToken;

import java.util.Optional;

public interface ReplyTokenRepository {
    /** Stores the token unless its hash is already taken; returns false on a hash collision. */
    boolean insertIfAbsent(ReplyToken token);
    Optional<ReplyToken> findByHash(String hash);
    boolean existsForPair(long senderId, long receiverId);
}
