package com.matey.anomaly.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One anomaly verdict returned by the detection API.
 *
 * <p>{@code index} points into the submitted batch. Fields the API adds beyond
 * explanation, metrics and index are kept in {@link #getExtra()} and written back
 * unchanged.</p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyRecord {

    @JsonAlias("why")
    private String explanation;

    private Map<String, Object> metrics = new LinkedHashMap<>();

    private Integer index;

    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String name, Object value) {
        extra.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    /**
     * Numeric metric by name (e.g. {@code ncd}, {@code confidence}), or null when the
     * metric is absent or not a number.
     */
    public Double metric(String name) {
        Object value = metrics == null ? null : metrics.get(name);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }
}
