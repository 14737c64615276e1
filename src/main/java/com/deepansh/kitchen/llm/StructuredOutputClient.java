package com.deepansh.kitchen.llm;

import com.deepansh.kitchen.exception.LlmException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Asks the LLM for a single JSON object shaped by a JSON schema.
 *
 * The schema is appended to the system message and JSON mode is requested.
 * Replies wrapped in markdown fences are unwrapped before parsing. Anything
 * that still is not a JSON object raises a non-retryable {@link LlmException}.
 * The returned tree is untrusted: callers validate every field they read.
 */
@Component
@Slf4j
public class StructuredOutputClient {

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    public StructuredOutputClient(LlmClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    public JsonNode requestJson(String systemMessage, String prompt, Map<String, Object> schema) {
        return requestJson(systemMessage, List.of(), prompt, schema);
    }

    public JsonNode requestJson(String systemMessage, List<Message> history,
                                String prompt, Map<String, Object> schema) {
        String fullSystemMessage;
        try {
            fullSystemMessage = systemMessage
                    + "\nYou must respond with a JSON object that conforms to this schema: "
                    + objectMapper.writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Schema is not serializable", e);
        }

        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(fullSystemMessage));
        messages.addAll(history);
        messages.add(Message.user(prompt));

        LlmResponse response = llmClient.chat(messages, ResponseFormat.JSON_OBJECT);
        return parseObject(response.getContent());
    }

    JsonNode parseObject(String content) {
        if (content == null || content.isBlank()) {
            throw new LlmException("LLM returned empty content where JSON was expected", false);
        }
        String json = stripFences(content.trim());
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new LlmException("LLM reply is not a JSON object", false);
            }
            return node;
        } catch (JsonProcessingException e) {
            log.warn("Unparseable LLM JSON reply: {}", truncate(content, 300));
            throw new LlmException("LLM reply is not valid JSON: " + e.getOriginalMessage(), false, e);
        }
    }

    private String stripFences(String content) {
        if (!content.startsWith("```")) {
            return content;
        }
        int firstNewline = content.indexOf('\n');
        int closing = content.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return content;
        }
        return content.substring(firstNewline + 1, closing).trim();
    }

    private String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
