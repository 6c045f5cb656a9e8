package com.qmb.core.analysis;

import com.qmb.core.model.Cardinality;
import com.qmb.core.model.EdgeSource;
import com.qmb.core.model.ModelRecommendation;
import com.qmb.core.model.ModelType;
import com.qmb.core.model.RelationshipEdge;
import com.qmb.core.model.TableAnalysis;
import com.qmb.core.model.TableClassification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ModelTypeRecommender}.
 */
class ModelTypeRecommenderTest {

    private final ModelTypeRecommender recommender = new ModelTypeRecommender(ClassificationThresholds.defaults());

    private static TableAnalysis table(String name, TableClassification classification, double confidence) {
        return new TableAnalysis(name, name + ".qvd", 100, true, List.of(), null, List.of(), classification,
                confidence, Map.of(), List.of());
    }

    private static RelationshipEdge edge(String from, String to, Cardinality cardinality) {
        return new RelationshipEdge(from, "Id", to, "Id", cardinality, 1.0, EdgeSource.HINT, null);
    }

    @Test
    @DisplayName("facts joined directly to dimensions give a star schema")
    void starSchema() {
        ModelRecommendation rec = recommender.recommend(
                List.of(table("Orders", TableClassification.FACT, 1.0), table("Customers", TableClassification.DIMENSION, 1.0)),
                List.of(edge("Orders", "Customers", Cardinality.ONE_TO_MANY)));

        assertEquals(ModelType.STAR_SCHEMA, rec.modelType());
        assertEquals(0.85, rec.confidence(), 0.001);
        assertTrue(rec.alternatives().contains(ModelType.NORMALIZED));
        assertFalse(rec.alternatives().contains(ModelType.STAR_SCHEMA));
    }

    @Test
    @DisplayName("a dimension referencing another dimension gives a snowflake")
    void snowflake() {
        ModelRecommendation rec = recommender.recommend(
                List.of(table("Orders", TableClassification.FACT, 0.8),
                        table("Products", TableClassification.DIMENSION, 0.8),
                        table("Categories", TableClassification.LOOKUP, 0.8)),
                List.of(edge("Orders", "Products", Cardinality.ONE_TO_MANY),
                        edge("Products", "Categories", Cardinality.ONE_TO_MANY)));

        assertEquals(ModelType.SNOWFLAKE, rec.modelType());
    }

    @Test
    @DisplayName("a many-to-many edge gives a link table model ahead of snowflake")
    void linkTable() {
        ModelRecommendation rec = recommender.recommend(
                List.of(table("Orders", TableClassification.FACT, 0.8),
                        table("Products", TableClassification.DIMENSION, 0.8),
                        table("Categories", TableClassification.DIMENSION, 0.8)),
                List.of(edge("Orders", "Products", Cardinality.ONE_TO_MANY),
                        edge("Products", "Categories", Cardinality.MANY_TO_MANY)));

        assertEquals(ModelType.LINK_TABLE, rec.modelType());
    }

    @Test
    @DisplayName("no fact table gives normalized")
    void noFactGivesNormalized() {
        ModelRecommendation rec = recommender.recommend(
                List.of(table("Customers", TableClassification.DIMENSION, 0.9)), List.of());

        assertEquals(ModelType.NORMALIZED, rec.modelType());
        assertTrue(rec.rationale().contains("No fact table"));
    }

    @Test
    @DisplayName("mean confidence under the floor gives normalized")
    void lowConfidenceGivesNormalized() {
        ModelRecommendation rec = recommender.recommend(
                List.of(table("Orders", TableClassification.FACT, 0.3), table("Customers", TableClassification.DIMENSION, 0.3)),
                List.of(edge("Orders", "Customers", Cardinality.ONE_TO_MANY)));

        assertEquals(ModelType.NORMALIZED, rec.modelType());
        assertTrue(rec.rationale().contains("below the floor"));
    }

    @Test
    @DisplayName("a disconnected graph gives normalized")
    void disconnectedGivesNormalized() {
        ModelRecommendation rec = recommender.recommend(
                List.of(table("Orders", TableClassification.FACT, 0.8),
                        table("Customers", TableClassification.DIMENSION, 0.8),
                        table("Weather", TableClassification.DIMENSION, 0.8)),
                List.of(edge("Orders", "Customers", Cardinality.ONE_TO_MANY)));

        assertEquals(ModelType.NORMALIZED, rec.modelType());
        assertTrue(rec.rationale().contains("disconnected"));
    }
}
