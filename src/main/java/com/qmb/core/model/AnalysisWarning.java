package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Non-fatal finding produced while analysing input.
 */
public record AnalysisWarning(
        @JsonProperty("type") Type type,
        @JsonProperty("table") String table,
        @JsonProperty("message") String message
) {
    public enum Type {
        UNMATCHED_TABLE,
        MISSING_SAMPLE_FIELD,
        INVALID_FIELD_NAME,
        LOW_CONFIDENCE,
        ORPHAN_TABLE,
        NO_FACT_TABLES,
        CIRCULAR_RELATIONSHIP,
        UNRESOLVED_RELATIONSHIP
    }
}
