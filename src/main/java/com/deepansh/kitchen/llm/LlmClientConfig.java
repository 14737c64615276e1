package com.deepansh.kitchen.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Factory that creates the active LLM client based on LLM_PROVIDER env var.
 * All agents and the intent resolver share it through ResilientLlmClient.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:groq}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url}") private String openAiBaseUrl;
    @Value("${openai.model}")    private String openAiModel;
    @Value("${openai.max-tokens}") private int openAiMaxTokens;
    @Value("${openai.temperature}") private double openAiTemp;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url}") private String groqBaseUrl;
    @Value("${groq.model}")    private String groqModel;
    @Value("${groq.max-tokens}") private int groqMaxTokens;
    @Value("${groq.temperature}") private double groqTemp;

    // Gemini
    @Value("${gemini.api-key:}") private String geminiKey;
    @Value("${gemini.base-url}") private String geminiBaseUrl;
    @Value("${gemini.model}")    private String geminiModel;
    @Value("${gemini.max-tokens}") private int geminiMaxTokens;
    @Value("${gemini.temperature}") private double geminiTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider.toUpperCase());
        log.info("  Model               : {}", activeModel());
        log.info("================================================================");
    }

    /**
     * The active LLM client, selected by LLM_PROVIDER.
     * Wrapped by ResilientLlmClient with a circuit breaker.
     */
    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(@Qualifier("llmRestClientBuilder") RestClient.Builder builder) {
        return switch (provider.toLowerCase()) {
            case "openai" -> {
                logKey("OPENAI", openAiKey, "OPENAI_API_KEY");
                yield new GenericLlmClient(props(openAiKey, openAiBaseUrl, openAiModel, openAiMaxTokens, openAiTemp),
                        "openai", builder.clone());
            }
            case "gemini" -> {
                logKey("GEMINI", geminiKey, "GEMINI_API_KEY");
                yield new GenericLlmClient(props(geminiKey, geminiBaseUrl, geminiModel, geminiMaxTokens, geminiTemp),
                        "gemini", builder.clone());
            }
            default -> { // groq
                logKey("GROQ", groqKey, "GROQ_API_KEY");
                yield new GenericLlmClient(props(groqKey, groqBaseUrl, groqModel, groqMaxTokens, groqTemp),
                        "groq", builder.clone());
            }
        };
    }

    private LlmProviderProperties props(String key, String baseUrl, String model, int maxTokens, double temperature) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(key); p.setBaseUrl(baseUrl); p.setModel(model);
        p.setMaxTokens(maxTokens); p.setTemperature(temperature);
        return p;
    }

    private String activeModel() {
        return switch (provider.toLowerCase()) {
            case "openai" -> openAiModel;
            case "gemini" -> geminiModel;
            default -> groqModel;
        };
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}={your-key}", name, envVar);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
