package io.datastoreadmin.config;

import io.datastoreadmin.errors.ConfigException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.datastoreadmin.config.Constants.DEFAULT_MAX_CLIENT_RETRIES;
import static io.datastoreadmin.config.Constants.DEFAULT_REQUEST_TIMEOUT_MS;

/**
 * The {@code datastore} section of the config file.
 */
@Getter
@AllArgsConstructor
public class DatastoreConfig {

    private static final List<String> EXPECTED_KEYS = List.of(
        "clusters", "index_definitions", "log_traffic", "max_client_retries", "request_timeout_ms");

    private final Map<String, ClusterDefinition> clusters;
    private final Map<String, IndexDefinitionConfig> indexDefinitions;
    private final boolean logTraffic;
    private final int maxClientRetries;
    private final long requestTimeoutMs;

    @SuppressWarnings("unchecked")
    public static DatastoreConfig fromParsedYaml(Map<String, Object> parsedYaml) {
        Object datastore = parsedYaml == null ? null : parsedYaml.get("datastore");
        if (!(datastore instanceof Map)) {
            throw new ConfigException("Config is missing the `datastore` section.");
        }

        Map<String, Object> datastoreMap = (Map<String, Object>) datastore;
        List<String> extraKeys = new ArrayList<>(datastoreMap.keySet());
        extraKeys.removeAll(EXPECTED_KEYS);
        if (!extraKeys.isEmpty()) {
            throw new ConfigException("Unknown `datastore` config settings: " + String.join(", ", extraKeys));
        }

        if (datastoreMap.get("clusters") == null) {
            throw new ConfigException("Config is missing `datastore.clusters`.");
        }
        if (datastoreMap.get("index_definitions") == null) {
            throw new ConfigException("Config is missing `datastore.index_definitions`.");
        }

        return new DatastoreConfig(
            ClusterDefinition.definitionsByNameFrom((Map<String, Map<String, Object>>) datastoreMap.get("clusters")),
            IndexDefinitionConfig.definitionsByNameFrom((Map<String, Map<String, Object>>) datastoreMap.get("index_definitions")),
            Boolean.parseBoolean(String.valueOf(datastoreMap.getOrDefault("log_traffic", false))),
            ((Number) datastoreMap.getOrDefault("max_client_retries", DEFAULT_MAX_CLIENT_RETRIES)).intValue(),
            ((Number) datastoreMap.getOrDefault("request_timeout_ms", DEFAULT_REQUEST_TIMEOUT_MS)).longValue()
        );
    }
}
