package com.flagship.payout_engine.observability;

import com.flagship.payout_engine.outbox.OutboxEventRepository;
import com.flagship.payout_engine.transaction.TransactionRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Health indicators for the payout engine.
 *
 * Backlogs report WARNING before DOWN. Redis only ever reports DEGRADED
 * when it is unreachable, because submission idempotency falls back to the
 * database.
 */
public class HealthIndicators {

    private static final String REDIS_FALLBACK_NOTE = "Idempotency lookups fall back to the database";

    /**
     * Unhealthy if too many state-change events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                return backlog(backlogSize, BACKLOG_WARNING_THRESHOLD, BACKLOG_CRITICAL_THRESHOLD)
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Unhealthy if resubmissions pile up faster than the retry runs drain them.
     */
    @Component("retryBacklogHealth")
    public static class RetryBacklogHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 200;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 2000;

        private final TransactionRepository transactionRepository;
        private final Clock clock;

        public RetryBacklogHealthIndicator(TransactionRepository transactionRepository, Clock clock) {
            this.transactionRepository = transactionRepository;
            this.clock = clock;
        }

        @Override
        public Health health() {
            try {
                long due = transactionRepository.countDueForRetry(clock.instant());
                return backlog(due, BACKLOG_WARNING_THRESHOLD, BACKLOG_CRITICAL_THRESHOLD)
                        .withDetail("dueForRetry", due)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final Optional<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(Optional<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate
                    .map(StringRedisTemplate::getConnectionFactory)
                    .orElse(null);
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis is not configured")
                        .withDetail("note", REDIS_FALLBACK_NOTE)
                        .build();
            }

            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", result != null ? result : "null")
                        .withDetail("note", REDIS_FALLBACK_NOTE)
                        .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", REDIS_FALLBACK_NOTE)
                        .build();
            }
        }
    }

    private static Health.Builder backlog(long size, long warning, long critical) {
        if (size < warning) {
            return Health.up();
        }
        return size < critical ? Health.status("WARNING") : Health.down();
    }
}
