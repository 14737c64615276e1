package com.deepansh.kitchen.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-based idempotency for query submissions.
 *
 * A client that retries a submission (e.g. after a network timeout) sends the
 * same Idempotency-Key and receives the cached FinalResponse instead of
 * running the workflow a second time.
 *
 * Key pattern: kitchen:idempotency:{idempotencyKey}
 * TTL: 24 hours
 *
 * Opt-in: requests without a key always run fresh.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "kitchen:idempotency:";
    private static final Duration TTL = Duration.ofHours(24);
    // Stored while the request is in flight
    static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;

    public IdempotencyService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Returns the cached response JSON for a completed request with this key,
     * or empty if the key is new or still in flight.
     */
    public Optional<String> getCachedResponse(String idempotencyKey) {
        String existing = redisTemplate.opsForValue().get(buildKey(idempotencyKey));

        if (existing == null) {
            return Optional.empty();
        }

        if (IN_FLIGHT_SENTINEL.equals(existing)) {
            log.warn("Idempotency key {} is in-flight, proceeding anyway", idempotencyKey);
            return Optional.empty();
        }

        log.info("Idempotency hit for key={}", idempotencyKey);
        return Optional.of(existing);
    }

    /**
     * Mark key as in-flight atomically (SET NX).
     * Returns true if claim succeeded, false if another request beat us to it.
     */
    public boolean claimKey(String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue()
                .setIfAbsent(buildKey(idempotencyKey), IN_FLIGHT_SENTINEL, TTL);
        return Boolean.TRUE.equals(claimed);
    }

    public void storeResponse(String idempotencyKey, String responseJson) {
        redisTemplate.opsForValue().set(buildKey(idempotencyKey), responseJson, TTL);
        log.debug("Stored idempotency response for key={}", idempotencyKey);
    }

    /** Clean up if the request failed so the client can retry. */
    public void releaseKey(String idempotencyKey) {
        redisTemplate.delete(buildKey(idempotencyKey));
        log.debug("Released idempotency key={}", idempotencyKey);
    }

    private String buildKey(String idempotencyKey) {
        return KEY_PREFIX + idempotencyKey;
    }
}
