package com.deepansh.kitchen.memory;

import com.deepansh.kitchen.intent.ConversationContext;
import com.deepansh.kitchen.intent.ConversationTurn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis-backed per-session conversation context.
 *
 * - Key pattern: kitchen:session:{sessionId}:turns
 * - Stored as a single JSON array, rewritten on every append
 * - TTL reset on every write so idle sessions expire
 * - Sliding window: only the last N turns are kept
 *
 * Read or write failures never fail a request; the session just starts fresh.
 */
@Component
@Slf4j
public class ConversationMemory {

    private static final String KEY_PREFIX = "kitchen:session:";
    private static final String KEY_SUFFIX = ":turns";
    private static final int MAX_SUMMARY_CHARS = 500;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kitchen.memory.ttl-minutes:60}")
    private long ttlMinutes = 60;

    @Value("${kitchen.memory.max-turns:10}")
    private int maxTurns = 10;

    public ConversationMemory(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Context for a session; empty if the session is new or has expired.
     */
    public ConversationContext load(String sessionId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(buildKey(sessionId));
        } catch (RuntimeException e) {
            log.error("Failed to read conversation context for session: {}. Starting fresh.", sessionId, e);
            return ConversationContext.empty(sessionId);
        }

        if (json == null) {
            log.debug("No conversation context for session: {}", sessionId);
            return ConversationContext.empty(sessionId);
        }

        try {
            List<ConversationTurn> turns = objectMapper.readValue(json, new TypeReference<>() {});
            log.debug("Loaded {} turns for session: {}", turns.size(), sessionId);
            return new ConversationContext(sessionId, turns);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize conversation for session: {}. Starting fresh.", sessionId, e);
            return ConversationContext.empty(sessionId);
        }
    }

    /**
     * Appends one exchange, applies the window and resets the TTL.
     */
    public void append(ConversationContext context, String query, String answerSummary) {
        List<ConversationTurn> turns = new ArrayList<>(context.turns());
        turns.add(new ConversationTurn(query, truncate(answerSummary), Instant.now()));
        List<ConversationTurn> windowed = applyWindow(turns);

        try {
            String json = objectMapper.writeValueAsString(windowed);
            redisTemplate.opsForValue().set(buildKey(context.sessionId()), json, Duration.ofMinutes(ttlMinutes));
            log.debug("Saved {} turns for session: {} (TTL: {}m)", windowed.size(), context.sessionId(), ttlMinutes);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize conversation for session: {}", context.sessionId(), e);
        } catch (RuntimeException e) {
            log.error("Failed to write conversation context for session: {}", context.sessionId(), e);
        }
    }

    public void clear(String sessionId) {
        redisTemplate.delete(buildKey(sessionId));
        log.info("Cleared conversation context for session: {}", sessionId);
    }

    public boolean exists(String sessionId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(buildKey(sessionId)));
    }

    private List<ConversationTurn> applyWindow(List<ConversationTurn> turns) {
        if (turns.size() <= maxTurns) {
            return turns;
        }
        return new ArrayList<>(turns.subList(turns.size() - maxTurns, turns.size()));
    }

    private String truncate(String s) {
        if (s == null) return null;
        return s.length() <= MAX_SUMMARY_CHARS ? s : s.substring(0, MAX_SUMMARY_CHARS) + "...";
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId + KEY_SUFFIX;
    }
}
