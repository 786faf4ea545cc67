package com.openforge.netagent.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.netagent.config.ToolProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Stateless JSON-over-HTTP GET client shared by the REST-based adapters.
 *
 * HTTP outcomes map to {@link AdapterErrorKind}:
 *   401 / 403          → UNAUTHORIZED
 *   404                → NOT_FOUND
 *   request timed out  → TIMEOUT
 *   anything else      → BACKEND_ERROR
 */
@Slf4j
public class RestBackendClient {

    /** How the API token travels. */
    public enum AuthStyle {
        /** {@code Authorization: Token <token>} */
        TOKEN,
        /** {@code X-Auth-Token: <token>} */
        X_AUTH_TOKEN
    }

    private static final int DEFAULT_TIMEOUT_SECONDS = 30;

    private final HttpClient     httpClient;
    private final ObjectMapper   objectMapper;
    private final String         toolName;
    private final ToolProperties config;
    private final AuthStyle      authStyle;

    public RestBackendClient(HttpClient httpClient,
                             ObjectMapper objectMapper,
                             String toolName,
                             ToolProperties config,
                             AuthStyle authStyle) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.toolName     = toolName;
        this.config       = config;
        this.authStyle    = authStyle;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * GET {@code baseUrl/path?params} and parse the body as JSON.
     * Collection-valued parameters are repeated once per element.
     */
    public JsonNode get(String path, Map<String, ?> params) {
        HttpRequest request = buildRequest(path, params);
        log.debug("[Backend:{}] → GET {}", toolName, request.uri());

        HttpResponse<String> response = send(request);
        int status = response.statusCode();
        log.debug("[Backend:{}] ← HTTP {} for {}", toolName, status, path);

        if (status == 401 || status == 403) {
            throw new AdapterException(AdapterErrorKind.UNAUTHORIZED,
                    "%s rejected credentials (HTTP %d)".formatted(toolName, status));
        }
        if (status == 404) {
            throw new AdapterException(AdapterErrorKind.NOT_FOUND,
                    "%s has no resource at %s".formatted(toolName, path));
        }
        if (status < 200 || status >= 300) {
            throw new AdapterException(AdapterErrorKind.BACKEND_ERROR,
                    "%s returned HTTP %d: %s".formatted(toolName, status, abbreviate(response.body())));
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new AdapterException(AdapterErrorKind.BACKEND_ERROR,
                    "%s returned a body that is not JSON".formatted(toolName), e);
        }
    }

    /**
     * Probes {@code path}; any 2xx counts as reachable. Never throws for
     * network or auth trouble.
     */
    public boolean testConnection(String path) {
        try {
            get(path, Map.of());
            return true;
        } catch (AdapterException e) {
            log.warn("[Backend:{}] Connection check failed: {}", toolName, e.getMessage());
            return false;
        }
    }

    public String toolName() {
        return toolName;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildRequest(String path, Map<String, ?> params) {
        if (config.baseUrl() == null || config.baseUrl().isBlank()) {
            throw new AdapterException(AdapterErrorKind.BACKEND_ERROR,
                    "%s has no base-url configured".formatted(toolName));
        }
        String base = config.baseUrl().endsWith("/") ? config.baseUrl() : config.baseUrl() + "/";
        String relative = path.startsWith("/") ? path.substring(1) : path;
        String query = encodeQuery(params);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(base + relative + (query.isEmpty() ? "" : "?" + query)))
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(config.timeoutSeconds() != null
                        ? config.timeoutSeconds() : DEFAULT_TIMEOUT_SECONDS))
                .GET();

        switch (authStyle) {
            case TOKEN        -> builder.header("Authorization", "Token " + config.apiToken());
            case X_AUTH_TOKEN -> builder.header("X-Auth-Token", config.apiToken());
        }
        return builder.build();
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new AdapterException(AdapterErrorKind.TIMEOUT,
                    "%s did not answer in time".formatted(toolName), e);
        } catch (IOException e) {
            throw new AdapterException(AdapterErrorKind.BACKEND_ERROR,
                    "Network error calling %s: %s".formatted(toolName, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdapterException(AdapterErrorKind.TIMEOUT,
                    "Call to %s was interrupted".formatted(toolName), e);
        }
    }

    static String encodeQuery(Map<String, ?> params) {
        if (params == null || params.isEmpty()) return "";
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((key, value) -> {
            if (value == null) return;
            if (value instanceof Collection<?> values) {
                values.forEach(v -> joiner.add(encode(key) + "=" + encode(String.valueOf(v))));
            } else {
                joiner.add(encode(key) + "=" + encode(String.valueOf(value)));
            }
        });
        return joiner.toString();
    }

    private static String encode(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 512 ? body : body.substring(0, 512) + "…";
    }
}
