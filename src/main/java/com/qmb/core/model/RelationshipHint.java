package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declared relationship between two fields, each written as {@code Table.Field}.
 * {@code from} is the referencing side, {@code to} the referenced side.
 */
public record RelationshipHint(
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("type") Cardinality type
) {}
