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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API, single turn.
 */
@Component
public class AnthropicClient extends HttpProviderSupport {

    // -------------------------------------------------------------------------
    // Wire records
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessagesResponse(List<ContentBlock> content, Usage usage) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        record ContentBlock(String type, String text) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Usage(@JsonProperty("input_tokens") int inputTokens,
                     @JsonProperty("output_tokens") int outputTokens) {}
    }

    private static final String DEFAULT_URL = "https://api.anthropic.com";
    private static final String API_VER     = "2023-06-01";

    private final String apiKey;

    public AnthropicClient(ProviderProperties properties, ObjectMapper objectMapper) {
        super(baseUrlOf(properties.anthropic(), DEFAULT_URL), objectMapper);
        this.apiKey = properties.anthropic() == null ? null : properties.anthropic().apiKey();
    }

    @Override
    public Vendor vendor() {
        return Vendor.ANTHROPIC;
    }

    @Override
    public boolean isConfigured() {
        return hasText(apiKey);
    }

    @Override
    public Generation generate(String model, Prompt prompt, GenerationParams params, Duration timeout) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",       model);
        body.put("max_tokens",  params.maxTokens());
        body.put("temperature", params.temperature());
        if (hasText(prompt.system())) {
            body.put("system", prompt.system());
        }
        body.put("messages", List.of(Map.of("role", "user", "content", prompt.user())));

        String respBody = post("/v1/messages", body,
                Map.of("x-api-key", apiKey, "anthropic-version", API_VER), timeout);

        // { id, type, role, content: [{type, text}], usage: {input_tokens, output_tokens} }
        MessagesResponse parsed = parse(respBody, MessagesResponse.class);
        if (parsed.content() == null) {
            throw malformed("response has no content");
        }
        String text = parsed.content().stream()
                .filter(b -> "text".equals(b.type()))
                .map(MessagesResponse.ContentBlock::text)
                .findFirst()
                .orElseThrow(() -> malformed("no text block in response"));
        TokenUsage usage = parsed.usage() == null ? null
                : new TokenUsage(parsed.usage().inputTokens(), parsed.usage().outputTokens());
        return new Generation(text, usage);
    }

    static String baseUrlOf(ProviderProperties.Vendor vendor, String fallback) {
        return vendor != null && hasText(vendor.baseUrl()) ? vendor.baseUrl() : fallback;
    }
}
