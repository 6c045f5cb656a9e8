package com.qmb.core.pipeline;

import com.qmb.core.ModelBuilderFixtures;
import com.qmb.core.error.SessionException;
import com.qmb.core.error.WorkflowException;
import com.qmb.core.events.ModelBuilderEvent;
import com.qmb.core.model.StageArtifact;
import com.qmb.core.model.StageId;
import com.qmb.core.model.StageState;
import com.qmb.core.script.FinalAssemblyFragmentBuilder;
import com.qmb.core.script.ScriptFragmentBuilder;
import com.qmb.core.session.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link StagePipeline}.
 */
class StagePipelineTest {

    private ModelBuilderFixtures.Core core;
    private StagePipeline pipeline;

    @BeforeEach
    void setUp() {
        core = new ModelBuilderFixtures.Core().readyToBuild();
        pipeline = core.pipeline;
    }

    private SessionState state() {
        return core.sessionStore.requireActive().state();
    }

    private void buildAndApproveThrough(StageId last) {
        for (StageId id : StageId.values()) {
            pipeline.build(id);
            pipeline.approve();
            if (id == last) {
                return;
            }
        }
    }

    /** Approved stages must always be a contiguous prefix of A-F. */
    private void assertApprovedPrefix() {
        boolean gap = false;
        for (StageId id : StageId.values()) {
            boolean approved = state().stage(id).approved();
            assertFalse(gap && approved, () -> "approved stage after a gap: " + state().stageBar());
            gap |= !approved;
        }
    }

    @Nested
    @DisplayName("construction")
    class ConstructionTests {

        @Test
        @DisplayName("requires a builder for every stage")
        void requiresEveryBuilder() {
            List<ScriptFragmentBuilder> one = List.of(new FinalAssemblyFragmentBuilder());

            assertThrows(IllegalStateException.class,
                    () -> new StagePipeline(core.sessionStore, one, core.eventBus, core.metrics));
        }

        @Test
        @DisplayName("rejects two builders for the same stage")
        void rejectsDuplicateBuilders() {
            List<ScriptFragmentBuilder> twice = List.of(new FinalAssemblyFragmentBuilder(), new FinalAssemblyFragmentBuilder());

            assertThrows(IllegalStateException.class,
                    () -> new StagePipeline(core.sessionStore, twice, core.eventBus, core.metrics));
        }
    }

    @Nested
    @DisplayName("build")
    class BuildTests {

        @Test
        @DisplayName("builds the current stage when none is named")
        void buildsCurrentStage() {
            StageBuildResult result = pipeline.build(null);

            assertEquals(StageId.A, result.artifact().stageId());
            assertEquals(StageState.BUILT, state().stage(StageId.A).state());
            assertNull(result.preview());
        }

        @Test
        @DisplayName("requires a selected model type")
        void requiresModelType() {
            core.sessionStore.start("Other");
            core.inputAnalyzer.processInput(ModelBuilderFixtures.customersOrdersSpec(),
                    ModelBuilderFixtures.customersOrdersSamples());

            WorkflowException ex = assertThrows(WorkflowException.class, () -> pipeline.build(StageId.A));
            assertTrue(ex.getMessage().startsWith("Model type not selected"));
        }

        @Test
        @DisplayName("requires an active session")
        void requiresSession() {
            core.sessionStore.reset();
            assertThrows(SessionException.class, () -> pipeline.build(StageId.A));
        }

        @Test
        @DisplayName("allows the next stage as a draft before the current one is approved")
        void buildsOneAheadOfPointer() {
            pipeline.build(StageId.A);

            StageBuildResult draft = pipeline.build(StageId.B);

            assertEquals(StageState.BUILT, draft.artifact().state());
            assertEquals(StageId.A, state().currentStage());
        }

        @Test
        @DisplayName("rejects a stage two steps ahead, naming the predecessor")
        void rejectsOutOfOrder() {
            WorkflowException ex = assertThrows(WorkflowException.class, () -> pipeline.build(StageId.C));

            assertTrue(ex.getMessage().contains("before stage B (Dimensions) is approved"));
            assertFalse(state().stage(StageId.C).isBuilt());
        }

        @Test
        @DisplayName("rejects rebuilding an approved stage")
        void rejectsApprovedStage() {
            buildAndApproveThrough(StageId.A);

            WorkflowException ex = assertThrows(WorkflowException.class, () -> pipeline.build(StageId.A));
            assertTrue(ex.getMessage().contains("qmb_go_back"));
        }

        @Test
        @DisplayName("rebuilding a draft replaces it")
        void rebuildReplacesDraft() {
            StageArtifact first = pipeline.build(StageId.A).artifact();
            StageArtifact second = pipeline.build(StageId.A).artifact();

            assertEquals(first.script(), second.script());
            assertSame(second, state().stage(StageId.A));
        }

        @Test
        @DisplayName("building F returns the assembled preview")
        void finalStagePreview() {
            buildAndApproveThrough(StageId.E);

            StageBuildResult result = pipeline.build(StageId.F);

            assertNotNull(result.preview());
            assertTrue(result.preview().contains("STAGE A: CONFIGURATION"));
            assertTrue(result.preview().contains("STAGE F: FINAL ASSEMBLY"));
        }
    }

    @Nested
    @DisplayName("approve")
    class ApproveTests {

        @Test
        @DisplayName("requires the current stage to be built")
        void requiresBuiltStage() {
            WorkflowException ex = assertThrows(WorkflowException.class, () -> pipeline.approve());
            assertTrue(ex.getMessage().contains("has not been built"));
        }

        @Test
        @DisplayName("advances the pointer and reports progress")
        void advancesPointer() {
            pipeline.build(StageId.A);

            ApprovalResult result = pipeline.approve();

            assertEquals(StageId.A, result.approved());
            assertEquals(StageId.B, result.nextStage());
            assertEquals(17, result.progressPercent());
            assertFalse(result.complete());
            assertEquals(StageId.B, state().currentStage());
        }

        @Test
        @DisplayName("approving F completes the pipeline at 100%")
        void completesPipeline() {
            buildAndApproveThrough(StageId.E);
            pipeline.build(StageId.F);

            ApprovalResult result = pipeline.approve();

            assertTrue(result.complete());
            assertNull(result.nextStage());
            assertEquals(100, result.progressPercent());
            assertTrue(state().complete());
            assertEquals(StageId.F, state().currentStage());
        }

        @Test
        @DisplayName("approving after completion is rejected")
        void rejectsApprovalWhenComplete() {
            buildAndApproveThrough(StageId.F);

            assertThrows(WorkflowException.class, () -> pipeline.approve());
        }

        @Test
        @DisplayName("publishes stage.approved with a script hash")
        void publishesApprovedEvent() {
            List<ModelBuilderEvent> events = new ArrayList<>();
            core.eventBus.subscribeAll(events::add);
            pipeline.build(StageId.A);

            pipeline.approve();

            ModelBuilderEvent approved = events.stream()
                    .filter(e -> e.eventType().equals("stage.approved")).findFirst().orElseThrow();
            assertEquals("A", approved.stage());
            assertEquals(64, approved.payload().get("scriptHash").toString().length());
            assertEquals(1.0, core.registry.find("qmb.stage.approvals").tag("stage", "A").counter().count());
        }
    }

    @Nested
    @DisplayName("goBack")
    class GoBackTests {

        @Test
        @DisplayName("invalidates later stages and keeps the target approved")
        void invalidatesLaterStages() {
            buildAndApproveThrough(StageId.C);
            pipeline.build(StageId.D);

            RevertResult result = pipeline.goBack(StageId.B);

            assertEquals(List.of(StageId.C, StageId.D), result.invalidated());
            assertEquals(StageId.B, state().currentStage());
            assertEquals(StageState.APPROVED, state().stage(StageId.A).state());
            assertEquals(StageState.APPROVED, state().stage(StageId.B).state());
            assertEquals(StageState.UNBUILT, state().stage(StageId.C).state());
            assertEquals(StageState.UNBUILT, state().stage(StageId.D).state());
            assertApprovedPrefix();

            String script = pipeline.getScript();
            assertTrue(script.contains("STAGE B: DIMENSIONS"));
            assertFalse(script.contains("STAGE C: FACTS"));
        }

        @Test
        @DisplayName("going back to A leaves its approved script readable")
        void backToFirstStage() {
            buildAndApproveThrough(StageId.B);

            pipeline.goBack(StageId.A);

            assertEquals(17, state().progressPercent());
            assertTrue(pipeline.getScript().contains("STAGE A: CONFIGURATION"));
        }

        @Test
        @DisplayName("reopens a completed pipeline")
        void reopensCompletedPipeline() {
            buildAndApproveThrough(StageId.F);

            pipeline.goBack(StageId.E);

            assertFalse(state().complete());
            assertEquals(StageId.E, state().currentStage());
            assertEquals(83, state().progressPercent());
            assertEquals(StageState.UNBUILT, state().stage(StageId.F).state());
        }

        @Test
        @DisplayName("approving the target again moves on without a rebuild")
        void reapproveTarget() {
            buildAndApproveThrough(StageId.C);
            pipeline.goBack(StageId.B);

            ApprovalResult result = pipeline.approve();

            assertEquals(StageId.B, result.approved());
            assertEquals(StageId.C, result.nextStage());
            assertEquals(33, result.progressPercent());
        }

        @Test
        @DisplayName("rebuilding the target turns it back into a draft and drops later drafts")
        void rebuildTarget() {
            buildAndApproveThrough(StageId.B);
            pipeline.goBack(StageId.A);
            pipeline.build(StageId.B);

            StageBuildResult rebuilt = pipeline.build(null);

            assertEquals(StageId.A, rebuilt.artifact().stageId());
            assertEquals(StageState.BUILT, state().stage(StageId.A).state());
            assertEquals(StageState.UNBUILT, state().stage(StageId.B).state());
            assertEquals(0, state().progressPercent());
            assertThrows(WorkflowException.class, () -> pipeline.getScript());
        }

        @Test
        @DisplayName("a completed pipeline must go back before F is rebuilt")
        void completedPipelineRebuild() {
            buildAndApproveThrough(StageId.F);

            WorkflowException ex = assertThrows(WorkflowException.class, () -> pipeline.build(StageId.F));
            assertTrue(ex.getMessage().contains("qmb_go_back"));

            pipeline.goBack(StageId.F);
            assertEquals(StageState.BUILT, pipeline.build(StageId.F).artifact().state());
        }

        @Test
        @DisplayName("rejects a target ahead of the current stage")
        void rejectsFutureTarget() {
            buildAndApproveThrough(StageId.A);

            assertThrows(WorkflowException.class, () -> pipeline.goBack(StageId.D));
        }

        @Test
        @DisplayName("approved stages stay a contiguous prefix through any transition")
        void approvedPrefixHolds() {
            buildAndApproveThrough(StageId.D);
            assertApprovedPrefix();
            pipeline.goBack(StageId.A);
            assertApprovedPrefix();
            pipeline.approve();
            pipeline.build(StageId.B);
            pipeline.build(StageId.C);
            assertApprovedPrefix();
            pipeline.approve();
            assertApprovedPrefix();
            pipeline.goBack(StageId.B);
            pipeline.build(null);
            assertApprovedPrefix();
        }
    }

    @Nested
    @DisplayName("concurrent calls")
    class ConcurrencyTests {

        /** Starts every task at once and waits for all of them. */
        private void race(List<Runnable> tasks) throws InterruptedException {
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(tasks.size());
            for (Runnable task : tasks) {
                new Thread(() -> {
                    try {
                        start.await();
                        task.run();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                }).start();
            }
            start.countDown();
            assertTrue(done.await(10, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("only one of several simultaneous approvals succeeds")
        void singleApprovalWins() throws InterruptedException {
            pipeline.build(StageId.A);
            AtomicInteger succeeded = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            List<Runnable> approvals = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                approvals.add(() -> {
                    try {
                        pipeline.approve();
                        succeeded.incrementAndGet();
                    } catch (WorkflowException e) {
                        rejected.incrementAndGet();
                    }
                });
            }

            race(approvals);

            assertEquals(1, succeeded.get());
            assertEquals(7, rejected.get());
            assertEquals(StageId.B, state().currentStage());
            assertEquals(17, state().progressPercent());
            assertEquals(1.0, core.registry.find("qmb.stage.approvals").tag("stage", "A").counter().count());
        }

        @Test
        @DisplayName("a build racing a revert always ends with the later stages unbuilt")
        void buildRacingGoBack() throws InterruptedException {
            for (int round = 0; round < 20; round++) {
                core = new ModelBuilderFixtures.Core().readyToBuild();
                pipeline = core.pipeline;
                buildAndApproveThrough(StageId.C);

                race(List.of(
                        () -> pipeline.goBack(StageId.B),
                        () -> {
                            try {
                                pipeline.build(StageId.D);
                            } catch (WorkflowException e) {
                                // the revert ran first and D is out of reach
                            }
                        }));

                assertEquals(StageId.B, state().currentStage());
                assertEquals(StageState.APPROVED, state().stage(StageId.B).state());
                assertEquals(StageState.UNBUILT, state().stage(StageId.C).state());
                assertEquals(StageState.UNBUILT, state().stage(StageId.D).state());
                assertApprovedPrefix();
            }
        }
    }

    @Nested
    @DisplayName("getScript")
    class GetScriptTests {

        @Test
        @DisplayName("requires at least one approved stage")
        void requiresApproval() {
            pipeline.build(StageId.A);
            assertThrows(WorkflowException.class, () -> pipeline.getScript());
        }

        @Test
        @DisplayName("omits a draft built ahead of approval")
        void omitsDrafts() {
            pipeline.build(StageId.A);
            pipeline.build(StageId.B);
            pipeline.approve();

            String script = pipeline.getScript();

            assertTrue(script.contains("STAGE A: CONFIGURATION"));
            assertFalse(script.contains("STAGE B: DIMENSIONS"));
        }

        @Test
        @DisplayName("a completed pipeline contains every stage in order")
        void completeScriptInOrder() {
            buildAndApproveThrough(StageId.F);

            String script = pipeline.getScript();

            int previous = -1;
            for (String header : List.of("STAGE A: CONFIGURATION", "STAGE B: DIMENSIONS", "STAGE C: FACTS",
                    "STAGE D: CALENDAR", "STAGE E: BRIDGE TABLES", "STAGE F: FINAL ASSEMBLY")) {
                int index = script.indexOf(header);
                assertTrue(index > previous, () -> header + " out of order");
                previous = index;
            }
            assertTrue(script.contains("[DIM_Customers]:"));
            assertTrue(script.contains("[FACT_Orders]:"));
            assertTrue(script.contains("STORE [FACT_Orders]"));
        }
    }
}
