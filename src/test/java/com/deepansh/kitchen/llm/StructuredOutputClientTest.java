package com.deepansh.kitchen.llm;

import com.deepansh.kitchen.exception.LlmException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StructuredOutputClientTest {

    @Mock LlmClient llmClient;

    StructuredOutputClient client;

    @BeforeEach
    void setUp() {
        client = new StructuredOutputClient(llmClient, new ObjectMapper());
    }

    @Test
    void requestJson_appendsSchemaAndAsksForJsonObject() {
        when(llmClient.chat(anyList(), eq(ResponseFormat.JSON_OBJECT)))
                .thenReturn(LlmResponse.builder().content("{\"dish_name\": \"Dal\"}").build());

        JsonNode node = client.requestJson("You are a chef.", "Dal recipe",
                Map.of("type", "object", "required", List.of("dish_name")));

        assertThat(node.get("dish_name").asText()).isEqualTo("Dal");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> messages = ArgumentCaptor.forClass(List.class);
        verify(llmClient).chat(messages.capture(), eq(ResponseFormat.JSON_OBJECT));
        assertThat(messages.getValue()).hasSize(2);
        assertThat(messages.getValue().get(0).getRole()).isEqualTo(Message.Role.system);
        assertThat(messages.getValue().get(0).getContent()).startsWith("You are a chef.").contains("dish_name");
        assertThat(messages.getValue().get(1).getContent()).isEqualTo("Dal recipe");
    }

    @Test
    void requestJson_historyGoesBetweenSystemAndPrompt() {
        when(llmClient.chat(anyList(), any())).thenReturn(LlmResponse.builder().content("{}").build());

        client.requestJson("system", List.of(Message.user("earlier"), Message.assistant("answer")), "now", Map.of());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> messages = ArgumentCaptor.forClass(List.class);
        verify(llmClient).chat(messages.capture(), any());
        assertThat(messages.getValue()).extracting(Message::getContent).endsWith("earlier", "answer", "now");
    }

    @Test
    void parseObject_fencedReply_isUnwrapped() {
        JsonNode node = client.parseObject("```json\n{\"calories_per_serving\": 320}\n```");

        assertThat(node.get("calories_per_serving").asInt()).isEqualTo(320);
    }

    @Test
    void parseObject_notJson_isNonRetryable() {
        assertThatThrownBy(() -> client.parseObject("Sure! Here is your recipe."))
                .isInstanceOfSatisfying(LlmException.class, e -> assertThat(e.isRetryable()).isFalse());
    }

    @Test
    void parseObject_jsonArray_isRejected() {
        assertThatThrownBy(() -> client.parseObject("[1, 2]"))
                .isInstanceOf(LlmException.class);
    }

    @Test
    void parseObject_empty_isRejected() {
        assertThatThrownBy(() -> client.parseObject("  "))
                .isInstanceOf(LlmException.class);
    }
}
