package com.deepansh.kitchen.memory;

import com.deepansh.kitchen.intent.ConversationContext;
import com.deepansh.kitchen.intent.ConversationTurn;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationMemoryTest {

    private static final String KEY = "kitchen:session:s1:turns";

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Mock StringRedisTemplate redisTemplate;
    @Mock ValueOperations<String, String> valueOps;

    ConversationMemory memory;

    @BeforeEach
    void setUp() {
        memory = new ConversationMemory(redisTemplate, objectMapper);
    }

    @Test
    void load_unknownSession_returnsEmptyContext() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(KEY)).thenReturn(null);

        ConversationContext context = memory.load("s1");

        assertThat(context.sessionId()).isEqualTo("s1");
        assertThat(context.isEmpty()).isTrue();
    }

    @Test
    void load_storedTurns_areRestored() throws Exception {
        List<ConversationTurn> turns = List.of(
                new ConversationTurn("Biryani recipe", "Chicken Biryani (serves 4)", Instant.parse("2024-05-01T10:00:00Z")));
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(KEY)).thenReturn(objectMapper.writeValueAsString(turns));

        ConversationContext context = memory.load("s1");

        assertThat(context.turns()).containsExactlyElementsOf(turns);
    }

    @Test
    void load_corruptJson_startsFresh() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(KEY)).thenReturn("{not json");

        assertThat(memory.load("s1").isEmpty()).isTrue();
    }

    @Test
    void load_redisDown_startsFresh() {
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(memory.load("s1").isEmpty()).isTrue();
    }

    @Test
    void append_keepsOnlyLastTurnsAndSetsTtl() throws Exception {
        List<ConversationTurn> turns = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            turns.add(new ConversationTurn("q" + i, "a" + i, Instant.now()));
        }
        when(redisTemplate.opsForValue()).thenReturn(valueOps);

        memory.append(new ConversationContext("s1", turns), "q10", "x".repeat(600));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq(KEY), json.capture(), eq(Duration.ofMinutes(60)));
        List<ConversationTurn> saved = objectMapper.readValue(json.getValue(), new TypeReference<>() {});
        assertThat(saved).hasSize(10);
        assertThat(saved.get(0).query()).isEqualTo("q1");
        assertThat(saved.get(9).query()).isEqualTo("q10");
        assertThat(saved.get(9).answerSummary()).hasSize(503).endsWith("...");
    }

    @Test
    void append_redisDown_doesNotThrow() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        doThrow(new RedisConnectionFailureException("refused"))
                .when(valueOps).set(anyString(), anyString(), any(Duration.class));

        memory.append(ConversationContext.empty("s1"), "hello", "hi");
    }

    @Test
    void clear_deletesSessionKey() {
        memory.clear("s1");

        verify(redisTemplate).delete(KEY);
    }

    @Test
    void exists_reflectsRedisKey() {
        when(redisTemplate.hasKey(KEY)).thenReturn(true);

        assertThat(memory.exists("s1")).isTrue();
    }
}
