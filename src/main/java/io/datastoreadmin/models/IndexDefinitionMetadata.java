package io.datastoreadmin.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Schema-derived runtime metadata of one index definition, as dumped to
 * {@code runtime_metadata.yaml} by the schema compiler.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexDefinitionMetadata {

    @Builder.Default
    @JsonProperty("route_with")
    private String routeWith = "id";

    // Absent for indices that do not roll over
    @JsonProperty("rollover")
    private RolloverMetadata rollover;

    @Builder.Default
    @JsonProperty("default_sort_fields")
    private List<SortField> defaultSortFields = new ArrayList<>();

    @Builder.Default
    @JsonProperty("current_sources")
    private Set<String> currentSources = new LinkedHashSet<>();

    @Builder.Default
    @JsonProperty("fields_by_path")
    private Map<String, FieldMetadata> fieldsByPath = new LinkedHashMap<>();
}
