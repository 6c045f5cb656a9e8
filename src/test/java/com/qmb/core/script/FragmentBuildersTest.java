package com.qmb.core.script;

import com.qmb.core.ModelBuilderFixtures;
import com.qmb.core.analysis.InputAnalyzer;
import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.BuildConfig;
import com.qmb.core.model.CalendarLanguage;
import com.qmb.core.model.ModelType;
import com.qmb.core.model.StageArtifact;
import com.qmb.core.model.StageId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the stage A-F fragment builders.
 */
class FragmentBuildersTest {

    private static final Instant NOW = Instant.parse("2025-03-14T10:00:00Z");

    private AnalysisResult analysis;
    private BuildConfig config;

    @BeforeEach
    void setUp() {
        InputAnalyzer analyzer = new ModelBuilderFixtures.Core().inputAnalyzer;
        analysis = analyzer.analyze(ModelBuilderFixtures.customersOrdersSpec(),
                ModelBuilderFixtures.customersOrdersSamples());
        config = new BuildConfig("lib://QVD/", "lib://QVD/Final/", "lib://DB/", CalendarLanguage.EN, true);
    }

    private BuildContext context(List<StageArtifact> approved) {
        return new BuildContext("Sales", analysis, ModelType.STAR_SCHEMA, config, approved, NOW);
    }

    private StageArtifact approved(ScriptFragment fragment) {
        return StageArtifact.built(fragment.stage(), fragment.script(), fragment.tables(), NOW).approve(NOW);
    }

    @Nested
    @DisplayName("key plan")
    class KeyPlanTests {

        @Test
        @DisplayName("renames the dimension key and the fact foreign key to the same association key")
        void renamesBothSides() {
            KeyPlan keys = KeyPlan.of(analysis);

            assertEquals("CustomerKey", keys.rename("Customers", "CustomerID").orElseThrow());
            assertEquals("CustomerKey", keys.rename("Orders", "CustomerID").orElseThrow());
            assertTrue(keys.rename("Orders", "OrderID").isEmpty());
            assertEquals("DIM_Customers", keys.owner("CustomerKey").orElseThrow());
        }

        @Test
        @DisplayName("keeps association and calendar date keys unqualified")
        void unqualifiedNames() {
            assertEquals(List.of("CustomerKey", "OrderDate"), KeyPlan.of(analysis).unqualifiedNames());
        }
    }

    @Nested
    @DisplayName("stage A")
    class ConfigurationTests {

        @Test
        @DisplayName("qualifies every field and exempts the association keys")
        void qualifiesFields() {
            ScriptFragment fragment = new ConfigurationFragmentBuilder().build(context(List.of()));

            assertEquals(StageId.A, fragment.stage());
            assertTrue(fragment.script().contains(ConfigurationFragmentBuilder.QUALIFY_DIRECTIVE));
            assertTrue(fragment.script().contains("UNQUALIFY CustomerKey, OrderDate;"));
            assertTrue(fragment.script().contains("// Project: Sales"));
            assertTrue(fragment.script().contains("// Generated: 2025-03-14"));
            assertTrue(fragment.tables().isEmpty());
        }

        @Test
        @DisplayName("writes the configured paths and calendar language")
        void writesVariables() {
            config = config.withQvdPath("lib://Data/").withCalendarLanguage(CalendarLanguage.HE);

            String script = new ConfigurationFragmentBuilder().build(context(List.of())).script();

            assertTrue(script.contains("SET vPathQVD = 'lib://Data/';"));
            assertTrue(script.contains("SET vPathOutput = 'lib://QVD/Final/';"));
            assertTrue(script.contains("SET vCalendarLanguage = 'HE';"));
        }
    }

    @Nested
    @DisplayName("stages B and C")
    class DimensionAndFactTests {

        @Test
        @DisplayName("loads the dimension with an autonumbered primary key")
        void loadsDimension() {
            ScriptFragment fragment = new DimensionFragmentBuilder().build(context(List.of()));

            assertEquals(List.of("DIM_Customers"), fragment.tables());
            assertTrue(fragment.script().contains("[DIM_Customers]:\nLOAD\n"
                    + "    AUTONUMBER(CustomerID, 'CustomerKey') AS CustomerKey,  // PK\n"
                    + "    CustomerName,\n"
                    + "    City\n"
                    + "FROM [$(vPathQVD)customers.qvd] (qvd);"));
        }

        @Test
        @DisplayName("loads the fact with its foreign key renamed")
        void loadsFact() {
            ScriptFragment fragment = new FactFragmentBuilder().build(context(List.of()));

            assertEquals(List.of("FACT_Orders"), fragment.tables());
            assertTrue(fragment.script().contains(
                    "    AUTONUMBER(CustomerID, 'CustomerKey') AS CustomerKey,  // FK -> DIM_Customers\n"));
            assertTrue(fragment.script().contains("    OrderDate,\n"));
            assertTrue(fragment.script().contains("FROM [$(vPathQVD)orders.qvd] (qvd);"));
        }

        @Test
        @DisplayName("without autonumber the key is a plain rename")
        void plainRename() {
            config = config.withUseAutonumber(false);

            String script = new DimensionFragmentBuilder().build(context(List.of())).script();

            assertTrue(script.contains("CustomerID AS CustomerKey,  // PK"));
            assertFalse(script.contains("AUTONUMBER"));
        }
    }

    @Nested
    @DisplayName("stage D")
    class CalendarTests {

        @Test
        @DisplayName("generates a master calendar over the observed order date range")
        void masterCalendar() {
            ScriptFragment fragment = new CalendarFragmentBuilder().build(context(List.of()));

            assertEquals(List.of("DIM_OrderDate"), fragment.tables());
            String script = fragment.script();
            assertTrue(script.contains("SUB " + CalendarFragmentBuilder.SUB_NAME + "(vDateField, vMinDate, vMaxDate)"));
            assertTrue(script.contains("LET vCalMinDate = Num(MakeDate(2023, 1, 1));"));
            assertTrue(script.contains("LET vCalMaxDate = Num(MakeDate(2024, 12, 31));"));
            assertTrue(script.contains("CALL CreateMasterCalendar('OrderDate', $(vCalMinDate), $(vCalMaxDate));"));
            assertTrue(script.contains("'Jan', 'Feb'"));
        }

        @Test
        @DisplayName("uses Hebrew labels when configured")
        void hebrewLabels() {
            config = config.withCalendarLanguage(CalendarLanguage.HE);

            String script = new CalendarFragmentBuilder().build(context(List.of())).script();

            assertTrue(script.contains("'ינואר'"));
            assertFalse(script.contains("'Jan'"));
        }
    }

    @Nested
    @DisplayName("stage E")
    class BridgeTests {

        @Test
        @DisplayName("emits no association tables for a plain star")
        void noAssociationTables() {
            ScriptFragment fragment = new BridgeFragmentBuilder().build(context(List.of()));

            assertTrue(fragment.tables().isEmpty());
            assertTrue(fragment.script().contains("no association tables required"));
        }

        @Test
        @DisplayName("loads a detected bridge table from source")
        void loadsBridgeTable() {
            analysis = new ModelBuilderFixtures.Core().inputAnalyzer.analyze(
                    ModelBuilderFixtures.bridgeSpec(), ModelBuilderFixtures.bridgeSamples());

            ScriptFragment fragment = new BridgeFragmentBuilder().build(context(List.of()));

            assertEquals(List.of("BRIDGE_Enrollments"), fragment.tables());
            assertTrue(fragment.script().contains("// Resolves Students <-> Courses (many-to-many)"));
            assertTrue(fragment.script().contains("AS StudentKey"));
            assertTrue(fragment.script().contains("AS CourseKey"));
        }
    }

    @Nested
    @DisplayName("stage F")
    class FinalAssemblyTests {

        @Test
        @DisplayName("stores every table loaded by the approved stages")
        void storesLoadedTables() {
            List<StageArtifact> approved = new ArrayList<>();
            approved.add(approved(new ConfigurationFragmentBuilder().build(context(approved))));
            approved.add(approved(new DimensionFragmentBuilder().build(context(approved))));
            approved.add(approved(new FactFragmentBuilder().build(context(approved))));
            approved.add(approved(new CalendarFragmentBuilder().build(context(approved))));
            approved.add(approved(new BridgeFragmentBuilder().build(context(approved))));

            ScriptFragment fragment = new FinalAssemblyFragmentBuilder().build(context(approved));

            String script = fragment.script();
            assertTrue(script.contains("// Assembled from stages A, B, C, D, E"));
            assertTrue(script.contains("// Consistency checks: no issues"), script);
            assertTrue(script.contains("STORE [DIM_Customers] INTO [$(vPathOutput)DIM_Customers.qvd] (qvd);"));
            assertTrue(script.contains("STORE [FACT_Orders] INTO [$(vPathOutput)FACT_Orders.qvd] (qvd);"));
            assertTrue(script.contains("STORE [DIM_OrderDate] INTO [$(vPathOutput)DIM_OrderDate.qvd] (qvd);"));
            assertTrue(fragment.tables().isEmpty());
        }

        @Test
        @DisplayName("reports tables no approved stage loads")
        void reportsUnreferencedTables() {
            List<StageArtifact> approved = List.of(approved(new ConfigurationFragmentBuilder().build(context(List.of()))));

            String script = new FinalAssemblyFragmentBuilder().build(context(approved)).script();

            assertTrue(script.contains("[UNREFERENCED_TABLE] Table Customers (DIM_Customers)"));
            assertTrue(script.contains("// Nothing to store"));
        }
    }
}
