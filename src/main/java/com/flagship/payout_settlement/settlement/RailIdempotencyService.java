package com.flagship.payout_settlement.settlement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Remembers successful rail attempts by idempotency key.
 *
 * Redis is the fast path only. The payment row is the source of truth: once
 * the COMPLETED write lands, settle returns ALREADY_COMPLETED before any
 * lookup here. This cache covers the window where the rail paid out but the
 * status write was lost, so a later attempt reuses the rail's transaction
 * instead of paying twice. Redis being down degrades to relying on the rail's
 * own Idempotency-Key handling.
 */
@Service
@Slf4j
public class RailIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "payout:rail:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final Optional<StringRedisTemplate> redisTemplate;

    public RailIdempotencyService(Optional<StringRedisTemplate> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    public static String keyFor(UUID paymentId) {
        return "settle-" + paymentId;
    }

    /**
     * @return the rail transaction ID of an earlier successful attempt with this key
     */
    public Optional<String> findSettledTransaction(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String transactionId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            if (transactionId != null) {
                log.info("Reusing earlier rail transaction for key {}: {}", idempotencyKey, transactionId);
            }
            return Optional.ofNullable(transactionId);
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}: {}", idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    public void recordSuccess(String idempotencyKey, String transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, transactionId, REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to record rail transaction in Redis for key {}: {}", idempotencyKey, e.getMessage());
        }
    }
}
