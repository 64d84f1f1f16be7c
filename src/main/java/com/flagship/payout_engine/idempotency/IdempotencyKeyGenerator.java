package com.flagship.payout_engine.idempotency;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Generates submission idempotency keys and transaction ids.
 *
 * With a client nonce the key is a pure function of (user, nonce), so a
 * resubmitted request maps onto the transaction it already created.
 * Without one, every call is a new logical request and the key is
 * {@code payout_{userId}_{epochMillis}_{16 hex chars}}.
 */
@Component
@RequiredArgsConstructor
public class IdempotencyKeyGenerator {

    private static final String KEY_PREFIX = "payout_";
    private static final String TRANSACTION_PREFIX = "txn_";
    private static final char[] ALPHANUMERIC = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public String submissionKey(String userId, String clientNonce) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required for an idempotency key");
        }
        if (clientNonce != null && !clientNonce.isBlank()) {
            return KEY_PREFIX + userId + "_n_" + sha256Hex(userId + ":" + clientNonce.trim()).substring(0, 32);
        }
        byte[] suffix = new byte[8];
        random.nextBytes(suffix);
        return KEY_PREFIX + userId + "_" + clock.millis() + "_" + HexFormat.of().formatHex(suffix);
    }

    /**
     * Caller-visible id: {@code txn_{epochMillis}_{6 random alphanumerics}}.
     */
    public String transactionId() {
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(ALPHANUMERIC[random.nextInt(ALPHANUMERIC.length)]);
        }
        return TRANSACTION_PREFIX + clock.millis() + "_" + suffix;
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
