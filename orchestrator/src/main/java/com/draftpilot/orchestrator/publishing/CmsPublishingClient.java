package com.draftpilot.orchestrator.publishing;

import com.draftpilot.orchestrator.config.PublishingProperties;
import com.draftpilot.orchestrator.resilience.OperationCancelledException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the headless CMS.
 *
 * Creates an article with {@code POST /api/articles} and a body of
 * {@code {"data": {...}}}; the response carries the new entry under
 * {@code data.id}.
 */
@Component
public class CmsPublishingClient implements PublishingTarget {

    private static final Logger log = LoggerFactory.getLogger(CmsPublishingClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiToken;
    private final Duration     timeout;

    public CmsPublishingClient(PublishingProperties properties, ObjectMapper objectMapper) {
        this.baseUrl  = properties.baseUrl();
        this.apiToken = properties.apiToken();
        this.timeout  = properties.timeout();
        this.json     = objectMapper;
        this.http     = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public PublishReceipt publish(PublishPayload payload) {
        log.info("Publishing job {} to CMS at {}", payload.jobId(), baseUrl);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("title",      payload.title());
        data.put("content",    payload.content());
        data.put("style",      payload.style());
        data.put("tone",       payload.tone());
        data.put("approvedBy", payload.approvedBy());
        data.put("sourceJob",  payload.jobId().toString());

        String body;
        try {
            body = json.writeValueAsString(Map.of("data", data));
        } catch (JsonProcessingException e) {
            throw new PublishingException("JSON serialization failed", false, e);
        }

        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/articles"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (apiToken != null && !apiToken.isBlank()) {
            req.header("Authorization", "Bearer " + apiToken);
        }

        HttpResponse<String> resp;
        try {
            resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("cms publish", e);
        } catch (IOException e) {
            throw new PublishingException("CMS unreachable: " + e.getMessage(), true, e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            boolean retryable = status == 429 || status >= 500;
            throw new PublishingException("CMS answered HTTP " + status + ": " + resp.body(), retryable);
        }

        try {
            JsonNode entry = json.readTree(resp.body()).path("data");
            String id = entry.path("id").asText(null);
            if (id == null) {
                throw new PublishingException("CMS response has no data.id", false);
            }
            String url = entry.path("url").asText(null);
            return new PublishReceipt(id, url);
        } catch (JsonProcessingException e) {
            throw new PublishingException("Failed to parse CMS response", false, e);
        }
    }
}
