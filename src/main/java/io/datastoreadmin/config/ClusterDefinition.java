package io.datastoreadmin.config;

import io.datastoreadmin.errors.ConfigException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A datastore cluster from the {@code datastore.clusters} section of the config file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterDefinition {

    private String url;

    // "elasticsearch" or "opensearch"
    private String backend;

    // Persistent cluster settings applied whenever index maintenance mode is toggled
    private Map<String, Object> settings = new LinkedHashMap<>();

    @SuppressWarnings("unchecked")
    public static Map<String, ClusterDefinition> definitionsByNameFrom(Map<String, Map<String, Object>> clusterMapsByName) {
        Map<String, ClusterDefinition> result = new LinkedHashMap<>();
        if (clusterMapsByName == null) {
            return result;
        }

        clusterMapsByName.forEach((name, clusterMap) -> {
            if (clusterMap == null || clusterMap.get("url") == null) {
                throw new ConfigException("Datastore cluster `" + name + "` lacks a `url`.");
            }
            Map<String, Object> settings = (Map<String, Object>) clusterMap.get("settings");
            result.put(name, new ClusterDefinition(
                (String) clusterMap.get("url"),
                (String) clusterMap.getOrDefault("backend", "opensearch"),
                settings == null ? new LinkedHashMap<>() : new LinkedHashMap<>(settings)
            ));
        });
        return result;
    }
}
