package io.datastoreadmin.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The environment-agnostic index configuration dumped to {@code datastore_config.yaml}.
 *
 * Mirrors the datastore's own payload shapes:
 * - indices: index name -> {mappings, settings}
 * - index_templates: template name -> {index_patterns, template: {mappings, settings}}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatastoreConfigArtifact {

    @JsonProperty("indices")
    private Map<String, Map<String, Object>> indices = new LinkedHashMap<>();

    @JsonProperty("index_templates")
    private Map<String, Map<String, Object>> indexTemplates = new LinkedHashMap<>();

    /**
     * Configurations of both indices and index templates, keyed by index definition name.
     */
    public Map<String, Map<String, Object>> configurationsByName() {
        Map<String, Map<String, Object>> all = new LinkedHashMap<>();
        if (indices != null) {
            all.putAll(indices);
        }
        if (indexTemplates != null) {
            all.putAll(indexTemplates);
        }
        return all;
    }
}
