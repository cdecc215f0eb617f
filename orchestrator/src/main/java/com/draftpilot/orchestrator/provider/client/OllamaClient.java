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
import java.util.Map;

/**
 * Local Ollama server, {@code /api/generate} with streaming off.
 * Needs no API key; configured whenever a base URL is set.
 */
@Component
public class OllamaClient extends HttpProviderSupport {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateResponse(String response,
                            @JsonProperty("prompt_eval_count") Integer promptEvalCount,
                            @JsonProperty("eval_count") Integer evalCount) {}

    private final boolean configured;

    public OllamaClient(ProviderProperties properties, ObjectMapper objectMapper) {
        super(properties.ollama() == null ? null : properties.ollama().baseUrl(), objectMapper);
        this.configured = properties.ollama() != null && hasText(properties.ollama().baseUrl());
    }

    @Override
    public Vendor vendor() {
        return Vendor.OLLAMA;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public Generation generate(String model, Prompt prompt, GenerationParams params, Duration timeout) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",  model);
        body.put("prompt", prompt.user());
        if (hasText(prompt.system())) {
            body.put("system", prompt.system());
        }
        body.put("stream",  false);
        body.put("options", Map.of("num_predict", params.maxTokens(),
                                   "temperature", params.temperature()));

        GenerateResponse parsed = parse(post("/api/generate", body, Map.of(), timeout), GenerateResponse.class);
        if (parsed.response() == null) {
            throw malformed("response field missing");
        }
        TokenUsage usage = parsed.promptEvalCount() == null || parsed.evalCount() == null ? null
                : new TokenUsage(parsed.promptEvalCount(), parsed.evalCount());
        return new Generation(parsed.response(), usage);
    }
}
