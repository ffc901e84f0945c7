package com.anonrelay.tokens;

import com.anonrelay.shared.model.ReplyToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Issues short opaque tokens that let a receiver answer a sender without either side learning who
 * the other is. Tokens never expire and may be resolved any number of times.
 */
public class ReplyTokenStore {

    private static final Logger log = LoggerFactory.getLogger(ReplyTokenStore.class);

    static final int TOKEN_LENGTH = 8;
    static final int MAX_ATTEMPTS = 16;

    private final ReplyTokenRepository repository;
    private final Clock clock;
    private final Supplier<byte[]> salts;

    public ReplyTokenStore(ReplyTokenRepository repository, Clock clock) {
        this(repository, clock, randomSalts(new SecureRandom()));
    }

    ReplyTokenStore(ReplyTokenRepository repository, Clock clock, Supplier<byte[]> salts) {
        this.repository = repository;
        this.clock = clock;
        this.salts = salts;
    }

    /**
     * Issues a fresh token for the pair. A hash that is already taken keeps pointing at its
     * original pair; the new token is drawn again with another salt.
     */
    public String issue(long senderId, long receiverId) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            var hash = token(senderId, receiverId, salts.get());
            if (repository.insertIfAbsent(new ReplyToken(hash, senderId, receiverId, LocalDateTime.now(clock)))) {
                return hash;
            }
            log.warn("Reply token collision on attempt {}, drawing a new salt", attempt);
        }
        throw new IllegalStateException("Could not issue a unique reply token after " + MAX_ATTEMPTS + " attempts");
    }

    public Optional<ReplyToken> resolve(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        return repository.findByHash(token);
    }

    public boolean existsForPair(long senderId, long receiverId) {
        return repository.existsForPair(senderId, receiverId);
    }

    static String token(long senderId, long receiverId, byte[] salt) {
        return hash(senderId + ":" + receiverId + ":" + HexFormat.of().formatHex(salt));
    }

    private static Supplier<byte[]> randomSalts(SecureRandom random) {
        return () -> {
            var salt = new byte[4];
            random.nextBytes(salt);
            return salt;
        };
    }

    private static String hash(String data) {
        try {
            var digest = MessageDigest.getInstance("MD5").digest(data.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, TOKEN_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
