package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Classified, relationship-resolved view of a session's input. Contains no timestamps so
 * that analysing the same input twice yields equal results.
 */
public record AnalysisResult(
        @JsonProperty("tables") List<TableAnalysis> tables,
        @JsonProperty("relationships") List<RelationshipEdge> relationships,
        @JsonProperty("recommendation") ModelRecommendation recommendation,
        @JsonProperty("warnings") List<AnalysisWarning> warnings,
        @JsonProperty("unresolved") List<String> unresolved
) {
    public AnalysisResult {
        tables = List.copyOf(tables);
        relationships = List.copyOf(relationships);
        warnings = List.copyOf(warnings);
        unresolved = List.copyOf(unresolved);
    }

    public Optional<TableAnalysis> table(String name) {
        return tables.stream().filter(t -> t.name().equalsIgnoreCase(name)).findFirst();
    }

    public List<TableAnalysis> tablesOf(TableClassification classification) {
        return tables.stream().filter(t -> t.classification() == classification).toList();
    }

    public List<RelationshipEdge> edgesFrom(String table) {
        return relationships.stream()
                .filter(e -> e.fromTable().equalsIgnoreCase(table) && e.cardinality() != Cardinality.MANY_TO_MANY)
                .toList();
    }

    public List<RelationshipEdge> manyToManyEdges() {
        return relationships.stream().filter(e -> e.cardinality() == Cardinality.MANY_TO_MANY).toList();
    }

    public double meanConfidence() {
        return tables.stream().mapToDouble(TableAnalysis::confidence).average().orElse(0.0);
    }
}
