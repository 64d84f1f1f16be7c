package com.flagship.payout_engine.idempotency;

import com.flagship.payout_engine.transaction.PayoutTransaction;
import com.flagship.payout_engine.transaction.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Looks up which transaction an idempotency key already belongs to.
 *
 * Strategy:
 * 1. Try Redis first (fast, may be unavailable)
 * 2. Fall back to the transaction table (the source of truth)
 * 3. Re-populate Redis on a database hit
 *
 * Redis failures are logged and ignored; submission never depends on it.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "payout:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final TransactionStore transactionStore;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(TransactionStore transactionStore,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.transactionStore = transactionStore;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the transaction id already bound to the key, if any
     */
    public Optional<String> findTransactionId(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String transactionId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (transactionId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(transactionId);
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<String> fromDatabase = transactionStore.getByIdempotencyKey(idempotencyKey)
                .map(PayoutTransaction::getTransactionId);
        fromDatabase.ifPresent(transactionId -> remember(idempotencyKey, transactionId));
        return fromDatabase;
    }

    /**
     * Caches the key in Redis. Best effort; the database row already holds it.
     */
    public void remember(String idempotencyKey, String transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, transactionId, REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }
}
