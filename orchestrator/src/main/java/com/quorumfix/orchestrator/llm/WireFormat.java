package com.quorumfix.orchestrator.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.quorumfix.orchestrator.provider.ProviderProfile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The two request/response envelopes QuorumFix speaks.
 *
 * Anthropic's Messages API and the OpenAI Chat Completions shape (used by
 * OpenAI itself and by OpenRouter for Qwen and DeepSeek) differ only in
 * headers, a couple of body fields and where the assistant text lives in
 * the reply.
 */
public enum WireFormat {

    /** POST /v1/messages; reply text in {@code content[type=text].text}. */
    ANTHROPIC_MESSAGES {
        @Override
        public Map<String, String> headers(ProviderProfile profile, String apiKey) {
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("content-type",      "application/json");
            headers.put("x-api-key",         apiKey);
            headers.put("anthropic-version", ANTHROPIC_VERSION);
            return headers;
        }

        @Override
        public Map<String, Object> requestBody(ProviderProfile profile, String prompt) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model",      profile.model());
            body.put("max_tokens", profile.maxTokens());
            body.put("messages",   List.of(Map.of("role", "user", "content", prompt)));
            return body;
        }

        @Override
        public Optional<String> extractText(JsonNode envelope) {
            for (JsonNode block : envelope.path("content")) {
                if ("text".equals(block.path("type").asText()) && block.path("text").isTextual()) {
                    return Optional.of(block.path("text").asText());
                }
            }
            return Optional.empty();
        }
    },

    /** POST /v1/chat/completions; reply text in {@code choices[0].message.content}. */
    OPENAI_CHAT {
        @Override
        public Map<String, String> headers(ProviderProfile profile, String apiKey) {
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("Content-Type",  "application/json");
            headers.put("Authorization", "Bearer " + apiKey);
            String host = profile.endpoint().getHost();
            if (host != null && host.contains("openrouter")) {
                headers.put("HTTP-Referer", OPENROUTER_REFERER);
                headers.put("X-Title",      OPENROUTER_TITLE);
            }
            return headers;
        }

        @Override
        public Map<String, Object> requestBody(ProviderProfile profile, String prompt) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model",       profile.model());
            body.put("messages",    List.of(Map.of("role", "user", "content", prompt)));
            body.put("max_tokens",  profile.maxTokens());
            body.put("temperature", profile.temperature());
            return body;
        }

        @Override
        public Optional<String> extractText(JsonNode envelope) {
            JsonNode content = envelope.path("choices").path(0).path("message").path("content");
            return content.isTextual() ? Optional.of(content.asText()) : Optional.empty();
        }
    };

    private static final String ANTHROPIC_VERSION  = "2023-06-01";
    private static final String OPENROUTER_REFERER = "https://github.com/quorumfix";
    private static final String OPENROUTER_TITLE   = "QuorumFix Multi-LLM Debug";

    public abstract Map<String, String> headers(ProviderProfile profile, String apiKey);

    public abstract Map<String, Object> requestBody(ProviderProfile profile, String prompt);

    /** Pull the assistant's text out of a parsed reply envelope. */
    public abstract Optional<String> extractText(JsonNode envelope);
}
