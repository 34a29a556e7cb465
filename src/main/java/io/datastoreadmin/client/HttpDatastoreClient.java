package io.datastoreadmin.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datastoreadmin.errors.BadDatastoreRequestException;
import io.datastoreadmin.errors.DatastoreAdminException;
import io.datastoreadmin.errors.RequestExceededDeadlineException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.datastoreadmin.config.Constants.KEY_INDEX_PATTERNS;
import static io.datastoreadmin.config.Constants.KEY_MAPPINGS;
import static io.datastoreadmin.config.Constants.KEY_SETTINGS;
import static io.datastoreadmin.config.Constants.KEY_TEMPLATE;

/**
 * Datastore client talking to the Elasticsearch/OpenSearch REST API over {@link HttpClient}.
 *
 * 4xx responses raise {@link BadDatastoreRequestException}; connection failures are retried
 * up to the configured number of times.
 */
@Slf4j
public class HttpDatastoreClient implements DatastoreClient {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> LIST_OF_MAPS_TYPE = new TypeReference<>() {};

    private final String clusterName;
    private final String baseUrl;
    private final HttpClient httpClient;
    private final boolean logTraffic;
    private final int maxRetries;
    private final Duration requestTimeout;

    public HttpDatastoreClient(String clusterName, String baseUrl, boolean logTraffic, int maxRetries, long requestTimeoutMs) {
        this(clusterName, baseUrl, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(),
            logTraffic, maxRetries, requestTimeoutMs);
    }

    HttpDatastoreClient(String clusterName, String baseUrl, HttpClient httpClient,
                        boolean logTraffic, int maxRetries, long requestTimeoutMs) {
        if (baseUrl == null || baseUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("Datastore URL cannot be null or empty");
        }
        this.clusterName = clusterName;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.logTraffic = logTraffic;
        this.maxRetries = maxRetries;
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
    }

    @Override
    public String getClusterName() {
        return clusterName;
    }

    // =================================================================
    // CLUSTER OPERATIONS
    // =================================================================

    @Override
    public Map<String, Object> getFlatClusterSettings() {
        return parseMap(send("GET", "/_cluster/settings?flat_settings=true", null, false));
    }

    @Override
    public void putPersistentClusterSettings(Map<String, Object> settings) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("persistent", settings);
        send("PUT", "/_cluster/settings", body, false);
    }

    // =================================================================
    // INDEX TEMPLATE OPERATIONS
    // =================================================================

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> getIndexTemplate(String name) {
        String response = send("GET", "/_index_template/" + name + "?flat_settings=true", null, true);
        if (response == null) {
            return new LinkedHashMap<>();
        }

        Object templates = parseMap(response).get("index_templates");
        if (!(templates instanceof List)) {
            return new LinkedHashMap<>();
        }

        for (Object entry : (List<Object>) templates) {
            Map<String, Object> templateEntry = (Map<String, Object>) entry;
            if (name.equals(templateEntry.get("name"))) {
                Map<String, Object> indexTemplate = (Map<String, Object>) templateEntry.get("index_template");
                Map<String, Object> result = new LinkedHashMap<>();
                result.put(KEY_INDEX_PATTERNS, indexTemplate.get(KEY_INDEX_PATTERNS));
                result.put(KEY_TEMPLATE, indexTemplate.getOrDefault(KEY_TEMPLATE, new LinkedHashMap<>()));
                return result;
            }
        }
        return new LinkedHashMap<>();
    }

    @Override
    public void putIndexTemplate(String name, Map<String, Object> body) {
        send("PUT", "/_index_template/" + name, body, false);
    }

    @Override
    public void deleteIndexTemplate(String name) {
        send("DELETE", "/_index_template/" + name, null, true);
    }

    // =================================================================
    // INDEX OPERATIONS
    // =================================================================

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> getIndex(String name) {
        String response = send("GET", "/" + name + "?flat_settings=true&ignore_unavailable=true", null, true);
        if (response == null) {
            return new LinkedHashMap<>();
        }

        Object index = parseMap(response).get(name);
        if (!(index instanceof Map)) {
            return new LinkedHashMap<>();
        }

        Map<String, Object> indexMap = (Map<String, Object>) index;
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(KEY_MAPPINGS, indexMap.getOrDefault(KEY_MAPPINGS, new LinkedHashMap<>()));
        result.put(KEY_SETTINGS, indexMap.getOrDefault(KEY_SETTINGS, new LinkedHashMap<>()));
        return result;
    }

    @Override
    public List<String> listIndicesMatching(String expression) {
        String response = send("GET", "/_cat/indices/" + expression + "?format=json&h=index", null, true);
        List<String> names = new ArrayList<>();
        if (response == null) {
            return names;
        }

        try {
            for (Map<String, Object> row : OBJECT_MAPPER.readValue(response, LIST_OF_MAPS_TYPE)) {
                names.add(String.valueOf(row.get("index")));
            }
        } catch (JsonProcessingException e) {
            throw new DatastoreAdminException("Failed to parse index listing from cluster '" + clusterName + "'", e);
        }
        return names;
    }

    @Override
    public void createIndex(String index, Map<String, Object> body) {
        send("PUT", "/" + index, body, false);
    }

    @Override
    public void putIndexMapping(String index, Map<String, Object> body) {
        send("PUT", "/" + index + "/_mapping", body, false);
    }

    @Override
    public void putIndexSettings(String index, Map<String, Object> body) {
        send("PUT", "/" + index + "/_settings", body, false);
    }

    @Override
    public void deleteIndices(String... names) {
        if (names.length == 0) {
            return;
        }
        send("DELETE", "/" + String.join(",", names) + "?ignore_unavailable=true&allow_no_indices=true", null, false);
    }

    // =================================================================
    // HTTP PLUMBING
    // =================================================================

    /**
     * Sends a request and returns the response body. Returns null for a 404 when
     * {@code notFoundIsEmpty} is set.
     */
    private String send(String method, String path, Map<String, Object> body, boolean notFoundIsEmpty) {
        String requestBody = body == null ? null : toJson(body);
        HttpRequest request = buildRequest(method, path, requestBody);

        if (logTraffic) {
            log.info("Datastore request [{}]: {} {} {}", clusterName, method, path, requestBody != null ? requestBody : "");
        }

        HttpResponse<String> response = sendWithRetries(request);

        if (logTraffic) {
            log.info("Datastore response [{}]: status={}, body={}", clusterName, response.statusCode(), response.body());
        }

        int status = response.statusCode();
        if (status == 404 && notFoundIsEmpty) {
            return null;
        }
        if (status >= 400 && status < 500) {
            throw new BadDatastoreRequestException(String.format("[%d] %s %s on cluster '%s' was rejected: %s",
                status, method, path, clusterName, response.body()));
        }
        if (status >= 500) {
            throw new DatastoreAdminException(String.format("[%d] %s %s on cluster '%s' failed: %s",
                status, method, path, clusterName, response.body()));
        }
        return response.body();
    }

    private HttpRequest buildRequest(String method, String path, String requestBody) {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(requestTimeout)
            .header("Accept", "application/json");

        if (requestBody != null) {
            requestBuilder.header("Content-Type", "application/json");
            requestBuilder.method(method, HttpRequest.BodyPublishers.ofString(requestBody));
        } else {
            requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return requestBuilder.build();
    }

    private HttpResponse<String> sendWithRetries(HttpRequest request) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (HttpTimeoutException e) {
                throw new RequestExceededDeadlineException(String.format("%s %s on cluster '%s' exceeded the %dms timeout",
                    request.method(), request.uri(), clusterName, requestTimeout.toMillis()), e);
            } catch (IOException e) {
                if (attempt > maxRetries) {
                    log.error("Giving up on {} {} after {} attempts: {}", request.method(), request.uri(), attempt, e.getMessage());
                    throw new DatastoreAdminException("Failed to reach cluster '" + clusterName + "' at " + baseUrl
                        + ": " + e.getMessage(), e);
                }
                log.warn("Attempt {} of {} {} failed ({}), retrying", attempt, request.method(), request.uri(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DatastoreAdminException("Interrupted while calling cluster '" + clusterName + "'", e);
            }
        }
    }

    private String toJson(Map<String, Object> body) {
        try {
            return OBJECT_MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DatastoreAdminException("Failed to serialize request body: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> parseMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return OBJECT_MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new DatastoreAdminException("Failed to parse response from cluster '" + clusterName + "'", e);
        }
    }
}
