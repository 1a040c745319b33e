package com.clusterops.atlas;

import com.clusterops.provider.ProviderErrorException;
import com.clusterops.provider.ProviderException;
import com.clusterops.provider.ProviderTransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Properties;

/**
 * Thin JSON client for the Atlas Admin API, scoped to one project (group).
 *
 * <p>Every call carries the configured timeout. Connection failures, timeouts and throttling or
 * gateway responses surface as {@link ProviderTransportException}; an Atlas error payload (any of
 * {@code error}, {@code errorCode}, {@code detail}) or a body that is not JSON surfaces as
 * {@link ProviderErrorException}.
 */
public class AtlasApiClient {
    final static Logger LOG = LogManager.getLogger(AtlasApiClient.class);

    private static final String ACCEPT = "application/json";

    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final String groupId;
    private final String accessToken;
    private final Duration timeout;

    public AtlasApiClient(String baseUrl, String groupId, String accessToken, long timeoutMillis) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.groupId = groupId;
        this.accessToken = accessToken;
        this.timeout = Duration.ofMillis(timeoutMillis);
        this.http = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    public AtlasApiClient(Properties params) {
        this(params.getProperty("atlas.baseUrl"), params.getProperty("atlas.groupId"),
                params.getProperty("atlas.accessToken"),
                Long.parseLong(params.getProperty("provider.callTimeoutMillis", "30000")));
        if (groupId == null || groupId.isEmpty()) {
            throw new IllegalArgumentException("atlas.groupId is required");
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    // path relative to the project, e.g. "/clusters/app-1"
    public String projectPath(String path) {
        return "/groups/" + encode(groupId) + path;
    }

    public static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public JsonNode get(String path) throws ProviderException {
        return send("GET", path, null);
    }

    public JsonNode post(String path, JsonNode body) throws ProviderException {
        return send("POST", path, body);
    }

    public JsonNode patch(String path, JsonNode body) throws ProviderException {
        return send("PATCH", path, body);
    }

    public JsonNode delete(String path) throws ProviderException {
        return send("DELETE", path, null);
    }

    JsonNode send(String method, String path, JsonNode body) throws ProviderException {
        HttpRequest.BodyPublisher publisher;
        try {
            publisher = body == null ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not encode request body for " + path, e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", ACCEPT)
                .method(method, publisher);
        if (body != null) {
            builder.header("Content-Type", ACCEPT);
        }
        if (accessToken != null && !accessToken.isEmpty()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        HttpResponse<String> response;
        try {
            LOG.debug(method + " " + path);
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderTransportException(method + " " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderTransportException(method + " " + path + " interrupted", e);
        }
        return decode(method, path, response.statusCode(), response.body());
    }

    JsonNode decode(String method, String path, int status, String text) throws ProviderException {
        if (status == 429 || status == 502 || status == 503 || status == 504) {
            throw new ProviderTransportException(method + " " + path + " returned HTTP " + status);
        }
        JsonNode json = null;
        if (text != null && !text.trim().isEmpty()) {
            try {
                json = mapper.readTree(text);
            } catch (JsonProcessingException e) {
                String head = text.length() > 200 ? text.substring(0, 200) : text;
                LOG.error("Non-JSON response from " + method + " " + path + ": " + head);
                throw ProviderErrorException.malformed("Invalid response from Atlas API: " + head.trim(), e);
            }
        }
        if (json != null && json.isObject() && (json.has("error") || json.has("errorCode") || json.has("detail"))) {
            String errorCode = json.path("errorCode").isMissingNode() ? null : json.path("errorCode").asText();
            String detail = json.has("detail") ? json.path("detail").asText() : json.path("error").asText();
            throw new ProviderErrorException(errorCode, detail);
        }
        if (status >= 400) {
            throw new ProviderErrorException("HTTP_" + status, text == null || text.isEmpty() ? "HTTP " + status : text);
        }
        return json;
    }
}
