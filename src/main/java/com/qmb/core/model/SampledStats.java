package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Sampled statistics for one table, paired with its {@link RawTableSpec} by table name.
 */
public record SampledStats(
        @JsonProperty("table_name") String tableName,
        @JsonProperty("row_count") long rowCount,
        @JsonProperty("fields") List<FieldStats> fields
) {
    public SampledStats {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
