package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Profiled statistics for one field.
 */
public record FieldStats(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("cardinality") long cardinality,
        @JsonProperty("null_percent") double nullPercent,
        @JsonProperty("sample_values") List<String> sampleValues,
        @JsonProperty("min_value") String minValue,
        @JsonProperty("max_value") String maxValue
) {
    public FieldStats {
        sampleValues = sampleValues == null ? List.of() : List.copyOf(sampleValues);
    }

    public FieldStats(String name, String type, long cardinality, double nullPercent) {
        this(name, type, cardinality, nullPercent, List.of(), null, null);
    }
}
