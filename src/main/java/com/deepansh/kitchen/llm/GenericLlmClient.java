package com.deepansh.kitchen.llm;

import com.deepansh.kitchen.exception.LlmException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat client for Groq, OpenAI, and Gemini.
 *
 * Error handling strategy:
 *
 * | Error                    | Action                                   |
 * |--------------------------|------------------------------------------|
 * | 401 / other 4xx          | LlmException, retryable = false          |
 * | 400 model_decommissioned | LlmException, retryable = false, loud log|
 * | 429 rate limit           | LlmException, retryable = true           |
 * | 5xx server error         | LlmException, retryable = true           |
 * | network error            | LlmException, retryable = true           |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, ResponseFormat format) {
        Map<String, Object> requestBody = buildRequestBody(messages, format);

        log.debug("Sending {} messages to {} [model={}, format={}]",
                messages.size(), providerName, props.getModel(), format);

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        throw new LlmException(
                                providerName + " server error [" + res.getStatusCode() + "]: " + body, true);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);

        } catch (ResourceAccessException e) {
            throw new LlmException(providerName + " unreachable: " + e.getMessage(), true, e);
        }
    }

    private void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned")) {
            log.error("================================================================");
            log.error("  MODEL DECOMMISSIONED: {} is no longer supported.", props.getModel());
            log.error("  Update the model for provider '{}' in application.yml", providerName);
            log.error("================================================================");
            throw new LlmException("Model '" + props.getModel() + "' is decommissioned", false);
        }

        if (statusCode == 429) {
            throw new LlmException(providerName + " rate limit exceeded", true);
        }

        throw new LlmException(providerName + " client error [" + statusCode + "]: " + body, false);
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, ResponseFormat format) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formattedMessages);

        if (format == ResponseFormat.JSON_OBJECT) {
            body.put("response_format", Map.of("type", "json_object"));
        }

        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());
        m.put("content", msg.getContent() != null ? msg.getContent() : "");
        return m;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw new LlmException(providerName + " returned an empty body", true);
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new LlmException(providerName + " returned no choices in response", false);
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");

        return LlmResponse.builder()
                .content(message != null ? (String) message.get("content") : null)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
