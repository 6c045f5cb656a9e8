package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classified view of one source table.
 *
 * @param primaryKey  name of the primary-key-like field, or {@code null} when none was found
 * @param foreignKeys fields whose names match another table's primary key
 * @param scores      raw score of every competing classification rule
 */
public record TableAnalysis(
        @JsonProperty("name") String name,
        @JsonProperty("source_name") String sourceName,
        @JsonProperty("row_count") long rowCount,
        @JsonProperty("has_stats") boolean hasStats,
        @JsonProperty("fields") List<FieldProfile> fields,
        @JsonProperty("primary_key") String primaryKey,
        @JsonProperty("foreign_keys") List<String> foreignKeys,
        @JsonProperty("classification") TableClassification classification,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("scores") Map<TableClassification, Double> scores,
        @JsonProperty("reasoning") List<String> reasoning
) {
    public TableAnalysis {
        fields = List.copyOf(fields);
        foreignKeys = List.copyOf(foreignKeys);
        scores = Map.copyOf(scores);
        reasoning = List.copyOf(reasoning);
    }

    public Optional<FieldProfile> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equalsIgnoreCase(fieldName)).findFirst();
    }

    public List<FieldProfile> dateFields() {
        return fields.stream().filter(FieldProfile::dateField).toList();
    }

    /** Uniqueness of the primary key, or 0 when the table has none. */
    public double primaryKeyUniqueness() {
        if (primaryKey == null) {
            return 0.0;
        }
        return field(primaryKey).map(FieldProfile::uniqueness).orElse(0.0);
    }
}
