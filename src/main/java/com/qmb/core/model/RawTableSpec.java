package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structural declaration of a source table: its logical name, the QVD/source it is read
 * from, and its fields.
 */
public record RawTableSpec(
        @JsonProperty("name") String name,
        @JsonProperty("source_name") String sourceName,
        @JsonProperty("fields") List<FieldSpec> fields
) {
    public RawTableSpec {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
