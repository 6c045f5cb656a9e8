package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A resolved relationship. For one-to-many edges {@code from} is the child (many) side and
 * {@code to} the parent. Many-to-many edges derived from a bridge table name it in {@code via}.
 */
public record RelationshipEdge(
        @JsonProperty("from_table") String fromTable,
        @JsonProperty("from_field") String fromField,
        @JsonProperty("to_table") String toTable,
        @JsonProperty("to_field") String toField,
        @JsonProperty("cardinality") Cardinality cardinality,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("source") EdgeSource source,
        @JsonProperty("via") String via
) {
    public boolean touches(String table) {
        return fromTable.equalsIgnoreCase(table) || toTable.equalsIgnoreCase(table);
    }

    public String describe() {
        String text = fromTable + "." + fromField + " -> " + toTable + "." + toField
                + " (" + cardinality.wireName() + ")";
        return via == null ? text : text + " via " + via;
    }
}
