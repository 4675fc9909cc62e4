package com.flagship.payout_settlement.observability;

import com.flagship.payout_settlement.outbox.OutboxEventRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks for the payout service.
 */
public class HealthIndicators {

    /**
     * Down when the outbox backlog suggests the publisher is stuck.
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
                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();
                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the rail idempotency fast path, so an outage is DEGRADED, not DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Settlement continues; idempotency falls back to payment status";

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis not configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try (RedisConnection connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                        ? Health.up().withDetail("response", result).build()
                        : Health.down().withDetail("response", String.valueOf(result)).build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
