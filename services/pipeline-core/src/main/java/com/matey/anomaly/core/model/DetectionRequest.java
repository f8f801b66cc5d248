package com.matey.anomaly.core.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body of {@code POST /detect}. Optional thresholds are omitted when unset.
 * Serialized from fields only, so {@code pValueThreshold} appears once.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class DetectionRequest {

    private List<CanonicalRecord> events;

    @JsonProperty("window_size")
    private int windowSize;

    @JsonProperty("baseline_lines")
    private int baselineLines;

    @JsonProperty("ncd_threshold")
    private Double ncdThreshold;

    @JsonProperty("p_value_threshold")
    private Double pValueThreshold;
}
