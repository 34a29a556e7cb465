package io.datastoreadmin.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuntimeMetadata {

    @JsonProperty("index_definitions_by_name")
    private Map<String, IndexDefinitionMetadata> indexDefinitionsByName = new LinkedHashMap<>();
}
