package com.qmb.core.analysis;

import com.qmb.core.model.Cardinality;
import com.qmb.core.model.ModelRecommendation;
import com.qmb.core.model.ModelType;
import com.qmb.core.model.RelationshipEdge;
import com.qmb.core.model.TableAnalysis;
import com.qmb.core.model.TableClassification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Recommends a modeling pattern from the classified tables and their relationship graph.
 * <p>
 * Precedence: missing facts, a mean confidence under the floor or a disconnected graph give
 * {@code normalized}; otherwise any many-to-many edge gives {@code link_table}, any
 * dimension-to-dimension edge gives {@code snowflake}, and the rest is {@code star_schema}.
 */
public class ModelTypeRecommender {

    private static final double STAR_BASE = 0.85;
    private static final double DEFAULT_BASE = 0.8;
    private static final double NORMALIZED_BASE = 0.5;

    private final ClassificationThresholds thresholds;

    public ModelTypeRecommender(ClassificationThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public ModelRecommendation recommend(List<TableAnalysis> tables, List<RelationshipEdge> edges) {
        Map<String, TableClassification> roles = tables.stream()
                .collect(Collectors.toMap(t -> t.name().toLowerCase(Locale.ROOT), TableAnalysis::classification,
                        (a, b) -> a));
        Function<String, TableClassification> roleOf = name -> roles.get(name.toLowerCase(Locale.ROOT));

        long facts = tables.stream().filter(t -> t.classification() == TableClassification.FACT).count();
        double meanConfidence = tables.stream().mapToDouble(TableAnalysis::confidence).average().orElse(0.0);
        boolean manyToMany = edges.stream().anyMatch(e -> e.cardinality() == Cardinality.MANY_TO_MANY);
        boolean dimensionToDimension = edges.stream()
                .filter(e -> e.cardinality() != Cardinality.MANY_TO_MANY)
                .anyMatch(e -> isDimensionLike(roleOf.apply(e.fromTable())) && isDimensionLike(roleOf.apply(e.toTable())));

        List<String> graphTables = tables.stream()
                .filter(t -> t.classification() != TableClassification.CALENDAR)
                .map(TableAnalysis::name)
                .toList();
        boolean connected = new RelationshipGraph(graphTables, edges).isConnected(graphTables);

        ModelType chosen;
        String rationale;
        if (facts == 0) {
            chosen = ModelType.NORMALIZED;
            rationale = "No fact table was identified, so no central table can anchor a star.";
        } else if (meanConfidence < thresholds.confidenceFloor()) {
            chosen = ModelType.NORMALIZED;
            rationale = String.format(Locale.ROOT,
                    "Mean classification confidence %.2f is below the floor of %.2f.",
                    meanConfidence, thresholds.confidenceFloor());
        } else if (!connected) {
            chosen = ModelType.NORMALIZED;
            rationale = "The relationship graph is disconnected; some tables share no key with the rest.";
        } else if (manyToMany) {
            chosen = ModelType.LINK_TABLE;
            rationale = "Many-to-many relationships exist and need association tables.";
        } else if (dimensionToDimension) {
            chosen = ModelType.SNOWFLAKE;
            rationale = "Dimension tables reference other dimension tables.";
        } else {
            chosen = ModelType.STAR_SCHEMA;
            rationale = "Every fact table joins directly to dimension tables with no dimension-to-dimension "
                    + "or many-to-many edges.";
        }

        double base = switch (chosen) {
            case STAR_SCHEMA -> STAR_BASE;
            case NORMALIZED -> NORMALIZED_BASE;
            default -> DEFAULT_BASE;
        };
        double confidence = TableClassifier.round(base * (0.5 + 0.5 * meanConfidence));

        List<ModelType> alternatives = new ArrayList<>();
        for (ModelType type : ModelType.values()) {
            if (type == chosen) {
                continue;
            }
            boolean applicable = switch (type) {
                case STAR_SCHEMA -> !manyToMany && facts > 0;
                case SNOWFLAKE -> dimensionToDimension;
                case LINK_TABLE -> manyToMany || facts > 1;
                case NORMALIZED -> true;
            };
            if (applicable) {
                alternatives.add(type);
            }
        }
        return new ModelRecommendation(chosen, confidence, rationale, alternatives);
    }

    private static boolean isDimensionLike(TableClassification role) {
        return role == TableClassification.DIMENSION || role == TableClassification.LOOKUP;
    }
}
