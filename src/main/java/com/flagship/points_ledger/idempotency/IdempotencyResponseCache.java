package com.flagship.points_ledger.idempotency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis fast path for completed idempotent responses.
 *
 * Strategy:
 * 1. Look in Redis first (fast, but can be unavailable)
 * 2. On a miss or any Redis error, the caller goes to the database
 * 3. Responses are written to Redis only after the database commit
 *
 * The database stays the source of truth; Redis only ever holds responses
 * that are already durable.
 */
@Component
@Slf4j
public class IdempotencyResponseCache {

    private static final String REDIS_KEY_PREFIX = "idempotency:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean enabled;
    private final Duration ttl;

    public IdempotencyResponseCache(Optional<StringRedisTemplate> redisTemplate,
                                    @Value("${idempotency.redis-cache.enabled:true}") boolean enabled,
                                    @Value("${idempotency.redis-cache.ttl-hours:168}") long ttlHours) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
        this.ttl = Duration.ofHours(ttlHours);
    }

    public Optional<String> find(IdempotencyKeyDescriptor descriptor) {
        if (!isActive()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(redisTemplate.get().opsForValue().get(redisKey(descriptor)));
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    redisKey(descriptor), e.getMessage());
            return Optional.empty();
        }
    }

    public void store(IdempotencyKeyDescriptor descriptor, String responseJson) {
        if (!isActive() || responseJson == null) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey(descriptor), responseJson, ttl);
        } catch (Exception e) {
            log.warn("Failed to cache idempotent response in Redis for {}: {}",
                    redisKey(descriptor), e.getMessage());
        }
    }

    private boolean isActive() {
        return enabled && redisTemplate.isPresent();
    }

    /**
     * {@code idempotency:<len>:<endpoint>:<len>:<context>:<requestId>}. The
     * length prefixes keep keys distinct when a segment contains {@code ':'}.
     */
    static String redisKey(IdempotencyKeyDescriptor descriptor) {
        String endpoint = descriptor.getEndpoint();
        String context = descriptor.getContext();
        return REDIS_KEY_PREFIX
                + endpoint.length() + ":" + endpoint + ":"
                + context.length() + ":" + context + ":"
                + descriptor.getRequestId();
    }
}
