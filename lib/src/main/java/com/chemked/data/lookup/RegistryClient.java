package com.chemked.data.lookup;

import com.chemked.data.Version;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared plumbing for the JSON registries: one GET per query, no retries. A 404 means "not found";
 * any other failure makes the registry unavailable for that query.
 */
abstract class RegistryClient {
    private static final Logger LOGGER = Logger.getLogger(RegistryClient.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;

    RegistryClient(HttpClient httpClient, String baseUrl, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /** Agent string sent with every request. */
    String userAgent() {
        return Version.USER_AGENT;
    }

    Optional<JsonNode> fetch(String relativePath) throws LookupUnavailableException {
        URI uri;
        try {
            uri = URI.create(baseUrl + relativePath);
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.FINE, "Identifier {0} cannot form a registry URL", relativePath);
            return Optional.empty();
        }
        HttpRequest request =
                HttpRequest.newBuilder()
                        .uri(uri)
                        .timeout(timeout)
                        .header("Accept", "application/json")
                        .header("User-Agent", userAgent())
                        .GET()
                        .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Registry request to " + uri + " failed", ex);
            throw new LookupUnavailableException("Unable to reach " + uri.getHost() + ": " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LookupUnavailableException("Interrupted while querying " + uri.getHost(), ex);
        }
        int status = response.statusCode();
        if (status == 404) {
            return Optional.empty();
        }
        if (status != 200) {
            throw new LookupUnavailableException("HTTP " + status + " from " + uri);
        }
        try {
            return Optional.of(MAPPER.readTree(response.body()));
        } catch (JsonProcessingException ex) {
            throw new LookupUnavailableException("Malformed response from " + uri + ": " + ex.getOriginalMessage(), ex);
        }
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() ? value.asText() : null;
    }
}
