package com.qmb.core;

import com.qmb.core.analysis.InputAnalyzer;
import com.qmb.core.config.ModelBuilderProperties;
import com.qmb.core.events.EventBus;
import com.qmb.core.export.ExportPackager;
import com.qmb.core.metrics.ModelBuilderMetrics;
import com.qmb.core.model.Cardinality;
import com.qmb.core.model.FieldSpec;
import com.qmb.core.model.FieldStats;
import com.qmb.core.model.RawTableSpec;
import com.qmb.core.model.RelationshipHint;
import com.qmb.core.model.SampledStats;
import com.qmb.core.model.SourceSpec;
import com.qmb.core.pipeline.ModelTypeSelector;
import com.qmb.core.pipeline.StagePipeline;
import com.qmb.core.script.BridgeFragmentBuilder;
import com.qmb.core.script.CalendarFragmentBuilder;
import com.qmb.core.script.ConfigurationFragmentBuilder;
import com.qmb.core.script.DimensionFragmentBuilder;
import com.qmb.core.script.FactFragmentBuilder;
import com.qmb.core.script.FinalAssemblyFragmentBuilder;
import com.qmb.core.session.SessionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * Shared inputs and a fully wired core for tests that run without a Spring context.
 */
public final class ModelBuilderFixtures {

    private ModelBuilderFixtures() {}

    /** Customers (1,000 rows) and Orders (50,000 rows) joined by a declared CustomerID hint. */
    public static SourceSpec customersOrdersSpec() {
        return new SourceSpec(List.of(
                new RawTableSpec("Customers", "customers.qvd", List.of(
                        new FieldSpec("CustomerID", "integer"),
                        new FieldSpec("CustomerName", "string"),
                        new FieldSpec("City", "string"))),
                new RawTableSpec("Orders", "orders.qvd", List.of(
                        new FieldSpec("OrderID", "integer"),
                        new FieldSpec("CustomerID", "integer"),
                        new FieldSpec("OrderDate", "date"),
                        new FieldSpec("Amount", "decimal")))),
                List.of(new RelationshipHint("Orders.CustomerID", "Customers.CustomerID", Cardinality.MANY_TO_ONE)));
    }

    public static List<SampledStats> customersOrdersSamples() {
        return List.of(
                new SampledStats("Customers", 1_000, List.of(
                        new FieldStats("CustomerID", "integer", 1_000, 0.0),
                        new FieldStats("CustomerName", "string", 990, 0.0),
                        new FieldStats("City", "string", 200, 1.5))),
                new SampledStats("Orders", 50_000, List.of(
                        new FieldStats("OrderID", "integer", 50_000, 0.0),
                        new FieldStats("CustomerID", "integer", 980, 0.0),
                        new FieldStats("OrderDate", "date", 730, 0.0, List.of("2023-01-02", "2024-12-30"),
                                "2023-01-01", "2024-12-31"),
                        new FieldStats("Amount", "decimal", 40_000, 0.2))));
    }

    /**
     * Students and Courses joined through an Enrollments bridge, without hints.
     */
    public static SourceSpec bridgeSpec() {
        return new SourceSpec(List.of(
                new RawTableSpec("Students", "students.qvd", List.of(
                        new FieldSpec("StudentID", "integer"),
                        new FieldSpec("StudentName", "string"))),
                new RawTableSpec("Courses", "courses.qvd", List.of(
                        new FieldSpec("CourseID", "integer"),
                        new FieldSpec("Title", "string"))),
                new RawTableSpec("Enrollments", "enrollments.qvd", List.of(
                        new FieldSpec("StudentID", "integer"),
                        new FieldSpec("CourseID", "integer")))),
                List.of());
    }

    public static List<SampledStats> bridgeSamples() {
        return List.of(
                new SampledStats("Students", 2_000, List.of(
                        new FieldStats("StudentID", "integer", 2_000, 0.0),
                        new FieldStats("StudentName", "string", 1_990, 0.0))),
                new SampledStats("Courses", 300, List.of(
                        new FieldStats("CourseID", "integer", 300, 0.0),
                        new FieldStats("Title", "string", 300, 0.0))),
                new SampledStats("Enrollments", 9_000, List.of(
                        new FieldStats("StudentID", "integer", 1_800, 0.0),
                        new FieldStats("CourseID", "integer", 280, 0.0))));
    }

    /**
     * Every core service wired by hand, sharing one event bus and meter registry.
     */
    public static final class Core {
        public final ModelBuilderProperties properties = new ModelBuilderProperties();
        public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        public final EventBus eventBus = new EventBus();
        public final ModelBuilderMetrics metrics = new ModelBuilderMetrics(registry);
        public final SessionStore sessionStore = new SessionStore(properties, eventBus, metrics);
        public final InputAnalyzer inputAnalyzer = new InputAnalyzer(sessionStore, properties, eventBus, metrics);
        public final ModelTypeSelector selector = new ModelTypeSelector(sessionStore, eventBus);
        public final StagePipeline pipeline = new StagePipeline(sessionStore, List.of(
                new ConfigurationFragmentBuilder(),
                new DimensionFragmentBuilder(),
                new FactFragmentBuilder(),
                new CalendarFragmentBuilder(),
                new BridgeFragmentBuilder(),
                new FinalAssemblyFragmentBuilder()), eventBus, metrics);
        public final ExportPackager exportPackager = new ExportPackager(sessionStore, eventBus, metrics);

        /** Active session with the Customers/Orders input processed and star_schema selected. */
        public Core readyToBuild() {
            sessionStore.start("Sales");
            inputAnalyzer.processInput(customersOrdersSpec(), customersOrdersSamples());
            selector.selectModelType("star_schema");
            return this;
        }
    }
}
