package io.datastoreadmin.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rollover configuration of an index definition: how often a new concrete index starts,
 * and which record field decides the index a record is written to.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RolloverMetadata {

    @JsonProperty("frequency")
    private String frequency;

    @JsonProperty("timestamp_field_path")
    private String timestampFieldPath;
}
