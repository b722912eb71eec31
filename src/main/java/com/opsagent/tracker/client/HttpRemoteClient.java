package com.opsagent.tracker.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@link RemoteClient} backed by the JDK HTTP client.
 *
 * Every request carries the plugin token and user key headers and a fixed timeout. Timeouts,
 * connection failures and 5xx responses are retried with exponential backoff; anything else,
 * including 429, is handed back to the caller.
 */
@Component
public class HttpRemoteClient implements RemoteClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpRemoteClient.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final long BASE_BACKOFF_MS = 1000L;
    private static final long MAX_BACKOFF_MS = 10_000L;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI baseUri;
    private final String pluginToken;
    private final String userKey;
    private final Duration requestTimeout;
    private final int maxAttempts;

    public HttpRemoteClient(ObjectMapper objectMapper,
                            @Value("${tracker.api.base-url}") String baseUrl,
                            @Value("${tracker.api.plugin-token:}") String pluginToken,
                            @Value("${tracker.api.user-key:}") String userKey,
                            @Value("${tracker.api.timeout-seconds:30}") long timeoutSeconds,
                            @Value("${tracker.api.max-retries:3}") int maxRetries) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("tracker.api.base-url must not be blank.");
        }
        this.objectMapper = objectMapper;
        this.baseUri = URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
        this.pluginToken = pluginToken;
        this.userKey = userKey;
        this.requestTimeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        this.maxAttempts = Math.max(1, maxRetries);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
        logger.info("HttpRemoteClient initialized for {} (timeout {}s, attempts {})",
                baseUri, requestTimeout.toSeconds(), this.maxAttempts);
    }

    @Override
    public RemoteResponse request(String method, String path, JsonNode body) {
        HttpRequest request = buildRequest(method, path, body);
        TransientRemoteException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                logger.debug("Making {} request to {} (attempt {}/{})", method, path, attempt, maxAttempts);
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
                int status = response.statusCode();
                if (status >= 500) {
                    lastFailure = new TransientRemoteException("HTTP " + status + " from " + method + " " + path);
                    logger.warn("Received {} from {} {}, will retry", status, method, path);
                } else {
                    if (status >= 400) {
                        logger.error("HTTP error {} from {} {}", status, method, path);
                    } else {
                        logger.info("Request successful: {} {} -> {}", method, path, status);
                    }
                    return new RemoteResponse(status, parseBody(response.body()));
                }
            } catch (HttpTimeoutException e) {
                lastFailure = new TransientRemoteException("Timed out calling " + method + " " + path, e);
                logger.warn("Timeout calling {} {} (attempt {}/{})", method, path, attempt, maxAttempts);
            } catch (IOException e) {
                lastFailure = new TransientRemoteException("I/O error calling " + method + " " + path, e);
                logger.warn("I/O error calling {} {} (attempt {}/{}): {}", method, path, attempt, maxAttempts, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientRemoteException("Interrupted calling " + method + " " + path, e);
            }

            if (attempt < maxAttempts) {
                sleepBeforeRetry(attempt);
            }
        }
        throw lastFailure != null ? lastFailure : new TransientRemoteException("Request failed: " + method + " " + path);
    }

    private HttpRequest buildRequest(String method, String path, JsonNode body) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        HttpRequest.Builder builder = HttpRequest.newBuilder(baseUri.resolve(relative))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
        if (pluginToken != null && !pluginToken.isBlank()) {
            builder.header("X-PLUGIN-TOKEN", pluginToken);
        }
        if (userKey != null && !userKey.isBlank()) {
            builder.header("X-USER-KEY", userKey);
        }

        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(writeBody(body), StandardCharsets.UTF_8);
        return builder.method(method, publisher).build();
    }

    private String writeBody(JsonNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not serializable", e);
        }
    }

    private JsonNode parseBody(String payload) {
        if (payload == null || payload.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            // Non-JSON error pages still need to reach the caller as a readable message.
            ObjectNode wrapped = objectMapper.createObjectNode();
            wrapped.put("err_code", -1);
            wrapped.put("err_msg", payload.length() > 200 ? payload.substring(0, 200) : payload);
            return wrapped;
        }
    }

    private void sleepBeforeRetry(int attempt) {
        long jitter = ThreadLocalRandom.current().nextLong(50, 200);
        long sleepMs = (long) Math.min(MAX_BACKOFF_MS, BASE_BACKOFF_MS * Math.pow(2, attempt - 1) + jitter);
        try {
            Thread.sleep(sleepMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientRemoteException("Interrupted during backoff", ie);
        }
    }
}
