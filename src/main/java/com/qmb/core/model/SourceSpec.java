package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Complete structural input for a session: table declarations plus relationship hints.
 */
public record SourceSpec(
        @JsonProperty("tables") List<RawTableSpec> tables,
        @JsonProperty("relationship_hints") List<RelationshipHint> relationshipHints
) {
    public SourceSpec {
        tables = tables == null ? List.of() : List.copyOf(tables);
        relationshipHints = relationshipHints == null ? List.of() : List.copyOf(relationshipHints);
    }
}
