package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Recommended modeling pattern with the condition that decided it.
 */
public record ModelRecommendation(
        @JsonProperty("model_type") ModelType modelType,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("rationale") String rationale,
        @JsonProperty("alternatives") List<ModelType> alternatives
) {
    public ModelRecommendation {
        alternatives = List.copyOf(alternatives);
    }
}
