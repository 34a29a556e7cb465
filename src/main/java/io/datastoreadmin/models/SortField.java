package io.datastoreadmin.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SortField {

    @JsonProperty("field_path")
    private String fieldPath;

    // "asc" or "desc"
    @JsonProperty("direction")
    private String direction;

    /**
     * Converts to a datastore sort clause, e.g. {@code {"created_at": {"order": "desc"}}}.
     */
    public Map<String, Object> toSortClause() {
        return Map.of(fieldPath, Map.of("order", direction));
    }
}
