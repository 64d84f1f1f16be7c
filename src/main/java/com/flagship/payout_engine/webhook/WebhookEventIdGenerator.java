package com.flagship.payout_engine.webhook;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives webhook event ids and payload hashes.
 *
 * The id depends only on (account, event type, payout id, created_at), never
 * on the JSON text, so two deliveries of one event hash identically whatever
 * their key order. A redelivery that changes other fields under the same
 * created_at is therefore treated as a duplicate.
 */
public final class WebhookEventIdGenerator {

    private static final String UNKNOWN_SUBJECT = "unknown";

    private WebhookEventIdGenerator() {
        // Utility class
    }

    public static String eventId(String accountId, String eventType, String payoutId, long createdAt) {
        String subject = payoutId == null || payoutId.isBlank() ? UNKNOWN_SUBJECT : payoutId;
        String source = accountId + ":" + eventType + ":" + subject + ":" + createdAt;
        return sha256Hex(source).substring(0, 32);
    }

    public static String payloadHash(byte[] rawPayload) {
        return sha256Hex(rawPayload);
    }

    private static String sha256Hex(String value) {
        return sha256Hex(value.getBytes(StandardCharsets.UTF_8));
    }

    private static String sha256Hex(byte[] value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
