package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A declared field merged with its sampled statistics and the roles inferred for it.
 * {@code uniqueness} is cardinality divided by the table's row count, capped at 1.
 */
public record FieldProfile(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("cardinality") long cardinality,
        @JsonProperty("null_percent") double nullPercent,
        @JsonProperty("uniqueness") double uniqueness,
        @JsonProperty("key_like") boolean keyLike,
        @JsonProperty("date_field") boolean dateField,
        @JsonProperty("min_value") String minValue,
        @JsonProperty("max_value") String maxValue,
        @JsonProperty("sample_values") List<String> sampleValues
) {
    public FieldProfile {
        sampleValues = sampleValues == null ? List.of() : List.copyOf(sampleValues);
    }
}
