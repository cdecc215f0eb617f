package com.draftpilot.orchestrator.provider.client;

import com.draftpilot.orchestrator.config.ProviderProperties;
import com.draftpilot.orchestrator.provider.Generation;
import com.draftpilot.orchestrator.provider.GenerationParams;
import com.draftpilot.orchestrator.provider.Prompt;
import com.draftpilot.orchestrator.provider.TokenUsage;
import com.draftpilot.orchestrator.provider.Vendor;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions API.
 */
@Component
public class OpenAiClient extends HttpProviderSupport {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices, Usage usage) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Message(String role, String content) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Usage(@JsonProperty("prompt_tokens") int promptTokens,
                     @JsonProperty("completion_tokens") int completionTokens) {}
    }

    private static final String DEFAULT_URL = "https://api.openai.com";

    private final String apiKey;

    public OpenAiClient(ProviderProperties properties, ObjectMapper objectMapper) {
        super(AnthropicClient.baseUrlOf(properties.openai(), DEFAULT_URL), objectMapper);
        this.apiKey = properties.openai() == null ? null : properties.openai().apiKey();
    }

    @Override
    public Vendor vendor() {
        return Vendor.OPENAI;
    }

    @Override
    public boolean isConfigured() {
        return hasText(apiKey);
    }

    @Override
    public Generation generate(String model, Prompt prompt, GenerationParams params, Duration timeout) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (hasText(prompt.system())) {
            messages.add(Map.of("role", "system", "content", prompt.system()));
        }
        messages.add(Map.of("role", "user", "content", prompt.user()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",       model);
        body.put("max_tokens",  params.maxTokens());
        body.put("temperature", params.temperature());
        body.put("messages",    messages);

        String respBody = post("/v1/chat/completions", body,
                Map.of("Authorization", "Bearer " + apiKey), timeout);

        ChatResponse parsed = parse(respBody, ChatResponse.class);
        if (parsed.choices() == null || parsed.choices().isEmpty()
                || parsed.choices().get(0).message() == null
                || parsed.choices().get(0).message().content() == null) {
            throw malformed("response has no message content");
        }
        TokenUsage usage = parsed.usage() == null ? null
                : new TokenUsage(parsed.usage().promptTokens(), parsed.usage().completionTokens());
        return new Generation(parsed.choices().get(0).message().content(), usage);
    }
}
