package io.datastoreadmin.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Runtime metadata of a single indexed field.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldMetadata {

    // Name of the event source that populates the field ("__self" for the index's own type)
    @JsonProperty("source")
    private String source;
}
