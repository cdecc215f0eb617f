package com.draftpilot.orchestrator.provider.client;

import com.draftpilot.orchestrator.provider.ProviderClient;
import com.draftpilot.orchestrator.provider.ProviderException;
import com.draftpilot.orchestrator.provider.Vendor;
import com.draftpilot.orchestrator.resilience.OperationCancelledException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * Shared HTTP plumbing for the vendor clients: one JSON POST with status and
 * transport errors mapped onto {@link ProviderException.Kind}.
 */
abstract class HttpProviderSupport implements ProviderClient {

    protected final HttpClient   http;
    protected final ObjectMapper json;
    protected final String       baseUrl;

    protected HttpProviderSupport(String baseUrl, ObjectMapper objectMapper) {
        this(baseUrl, objectMapper, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    protected HttpProviderSupport(String baseUrl, ObjectMapper objectMapper, HttpClient http) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.json    = objectMapper;
        this.http    = http;
    }

    /** POST {@code body} as JSON; returns the 2xx response body. */
    protected String post(String path, Object body, Map<String, String> headers, Duration timeout) {
        Vendor vendor = vendor();
        String payload;
        try {
            payload = json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.BAD_REQUEST, vendor,
                    "request serialization failed", e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload));
        headers.forEach(builder::header);

        HttpResponse<String> resp;
        try {
            resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(vendor + " request", e);
        } catch (HttpConnectTimeoutException e) {
            throw new ProviderException(ProviderException.Kind.CONNECTION, vendor, "connect timed out", e);
        } catch (HttpTimeoutException e) {
            throw new ProviderException(ProviderException.Kind.TIMEOUT, vendor,
                    "no response within " + timeout.toMillis() + " ms", e);
        } catch (ConnectException e) {
            throw new ProviderException(ProviderException.Kind.CONNECTION, vendor, "connection refused", e);
        } catch (IOException e) {
            throw new ProviderException(ProviderException.Kind.CONNECTION, vendor, e.getMessage(), e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw ProviderException.fromStatus(vendor, resp.statusCode(), resp.body());
        }
        return resp.body();
    }

    protected <T> T parse(String body, Class<T> type) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.MALFORMED_RESPONSE, vendor(),
                    "could not parse " + type.getSimpleName(), e);
        }
    }

    protected ProviderException malformed(String message) {
        return new ProviderException(ProviderException.Kind.MALFORMED_RESPONSE, vendor(), message);
    }

    protected static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
