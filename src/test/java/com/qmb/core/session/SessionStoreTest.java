package com.qmb.core.session;

import com.qmb.core.ModelBuilderFixtures;
import com.qmb.core.error.SessionException;
import com.qmb.core.error.ValidationException;
import com.qmb.core.events.ModelBuilderEvent;
import com.qmb.core.model.StageId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SessionStore}.
 */
class SessionStoreTest {

    private ModelBuilderFixtures.Core core;
    private SessionStore store;

    @BeforeEach
    void setUp() {
        core = new ModelBuilderFixtures.Core();
        store = core.sessionStore;
    }

    @Nested
    @DisplayName("start")
    class StartTests {

        @Test
        @DisplayName("creates an active session at stage A with configured defaults")
        void createsActiveSession() {
            BuildSession session = store.start("Sales");

            assertTrue(session.getId().startsWith("QMB-"));
            assertEquals("Sales", session.getProjectName());
            assertEquals(SessionStatus.ACTIVE, session.getStatus());
            assertSame(session, store.requireActive());

            SessionState state = session.state();
            assertNull(state.analysis());
            assertNull(state.modelType());
            assertEquals(StageId.A, state.currentStage());
            assertFalse(state.complete());
            assertEquals(0, state.progressPercent());
            assertEquals("lib://QVD/", state.config().qvdPath());
        }

        @Test
        @DisplayName("rejects a blank project name")
        void rejectsBlankProjectName() {
            assertThrows(ValidationException.class, () -> store.start("  "));
            assertThrows(ValidationException.class, () -> store.start(null));
            assertTrue(store.active().isEmpty());
        }

        @Test
        @DisplayName("starting again suspends the previously active session")
        void startingAgainSuspendsPrevious() {
            BuildSession first = store.start("Sales");
            BuildSession second = store.start("Inventory");

            assertEquals(SessionStatus.SUSPENDED, first.getStatus());
            assertSame(second, store.requireActive());
            assertNotEquals(first.getId(), second.getId());
        }

        @Test
        @DisplayName("publishes session.started")
        void publishesStartedEvent() {
            List<ModelBuilderEvent> events = new ArrayList<>();
            core.eventBus.subscribeAll(events::add);

            BuildSession session = store.start("Sales");

            assertEquals(1, events.size());
            assertEquals("session.started", events.get(0).eventType());
            assertEquals(session.getId(), events.get(0).sessionId());
            assertEquals("Sales", events.get(0).payload().get("projectName"));
        }
    }

    @Nested
    @DisplayName("reset")
    class ResetTests {

        @Test
        @DisplayName("tears down the active session")
        void tearsDownActiveSession() {
            core.readyToBuild();
            BuildSession session = store.requireActive();

            SessionSummary summary = store.reset();

            assertEquals(session.getId(), summary.sessionId());
            assertEquals(SessionStatus.RESET, summary.status());
            assertTrue(store.active().isEmpty());
            assertNull(session.state().analysis());
        }

        @Test
        @DisplayName("fails without an active session")
        void failsWithoutActiveSession() {
            SessionException ex = assertThrows(SessionException.class, () -> store.reset());
            assertEquals(SessionException.NO_ACTIVE_SESSION, ex.getMessage());
        }

        @Test
        @DisplayName("operations on a reset session report no active session")
        void operationsAfterResetFail() {
            store.start("Sales");
            store.reset();

            assertThrows(SessionException.class, () -> store.withActiveSession(s -> s));
            assertThrows(SessionException.class, () -> core.pipeline.build(null));
        }
    }

    @Nested
    @DisplayName("resume and findRecent")
    class ResumeTests {

        @Test
        @DisplayName("a suspended session keeps its progress in the list")
        void suspendedSessionKeepsState() {
            core.readyToBuild();
            core.pipeline.build(null);
            core.pipeline.approve();
            store.start("Other");

            SessionSummary sales = store.list().stream()
                    .filter(s -> s.projectName().equals("Sales")).findFirst().orElseThrow();

            assertEquals(SessionStatus.SUSPENDED, sales.status());
            assertEquals("star_schema", sales.modelType());
            assertEquals("B", sales.currentStage());
            assertEquals(17, sales.progressPercent());
        }

        @Test
        @DisplayName("resume reactivates a session where it left off")
        void resumeRestoresSession() {
            core.readyToBuild();
            core.pipeline.build(null);
            core.pipeline.approve();
            BuildSession sales = store.requireActive();
            BuildSession other = store.start("Other");
            List<ModelBuilderEvent> events = new ArrayList<>();
            core.eventBus.subscribeAll(events::add);

            BuildSession resumed = store.resume(sales.getId().toLowerCase());

            assertSame(sales, resumed);
            assertSame(sales, store.requireActive());
            assertEquals(SessionStatus.ACTIVE, sales.getStatus());
            assertEquals(SessionStatus.SUSPENDED, other.getStatus());
            assertEquals(StageId.B, sales.state().currentStage());
            assertNotNull(sales.state().analysis());
            assertEquals("session.resumed", events.get(0).eventType());
            assertEquals(StageId.B, core.pipeline.build(null).artifact().stageId());
        }

        @Test
        @DisplayName("resuming the active session changes nothing")
        void resumeActiveIsNoOp() {
            BuildSession session = store.start("Sales");
            List<ModelBuilderEvent> events = new ArrayList<>();
            core.eventBus.subscribeAll(events::add);

            assertSame(session, store.resume(session.getId()));
            assertEquals(SessionStatus.ACTIVE, session.getStatus());
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("a reset session resumes empty")
        void resumeResetSession() {
            core.readyToBuild();
            BuildSession session = store.requireActive();
            store.reset();

            store.resume(session.getId());

            assertEquals(SessionStatus.ACTIVE, session.getStatus());
            assertNull(session.state().analysis());
            assertNull(session.state().modelType());
        }

        @Test
        @DisplayName("resume rejects unknown and blank ids")
        void resumeRejectsUnknownIds() {
            store.start("Sales");

            SessionException ex = assertThrows(SessionException.class, () -> store.resume("QMB-1999-0042"));
            assertEquals("Session not found: QMB-1999-0042", ex.getMessage());
            assertThrows(ValidationException.class, () -> store.resume(" "));
            assertEquals("Sales", store.requireActive().getProjectName());
        }

        @Test
        @DisplayName("findRecent matches the project name case-insensitively")
        void findRecentByProject() {
            BuildSession sales = store.start("Sales");
            store.start("Other");

            Optional<SessionSummary> found = store.findRecent("SALES");

            assertTrue(found.isPresent());
            assertEquals(sales.getId(), found.get().sessionId());
            assertTrue(store.findRecent("Inventory").isEmpty());
            assertThrows(ValidationException.class, () -> store.findRecent(null));
        }

        @Test
        @DisplayName("findRecent skips sessions outside the resume window")
        void findRecentHonoursWindow() {
            store.start("Sales");
            core.properties.getSessions().setResumeWindowHours(0);

            assertTrue(store.findRecent("Sales").isEmpty());
        }
    }

    @Nested
    @DisplayName("list and status")
    class ListAndStatusTests {

        @Test
        @DisplayName("lists active and suspended sessions")
        void listsKnownSessions() {
            store.start("Sales");
            store.start("Inventory");

            List<SessionSummary> sessions = store.list();

            assertEquals(2, sessions.size());
            SessionSummary sales = sessions.stream().filter(s -> s.projectName().equals("Sales")).findFirst().orElseThrow();
            SessionSummary inventory = sessions.stream().filter(s -> s.projectName().equals("Inventory")).findFirst().orElseThrow();
            assertEquals(SessionStatus.SUSPENDED, sales.status());
            assertEquals(SessionStatus.ACTIVE, inventory.status());
            assertEquals("A", inventory.currentStage());
        }

        @Test
        @DisplayName("forgets the oldest sessions past the configured maximum")
        void evictsOldestSessions() {
            core.properties.getSessions().setMaxKnown(2);

            store.start("One");
            store.start("Two");
            store.start("Three");

            List<String> names = store.list().stream().map(SessionSummary::projectName).toList();
            assertEquals(2, names.size());
            assertFalse(names.contains("One"));
        }

        @Test
        @DisplayName("status explains how to start when no session is active")
        void statusWithoutSession() {
            assertTrue(store.status().startsWith("No active session"));
        }

        @Test
        @DisplayName("status summarises the active session")
        void statusSummarisesActiveSession() {
            core.readyToBuild();

            String status = store.status();

            assertTrue(status.contains("Project: Sales"));
            assertTrue(status.contains("2 table(s) analysed, recommended star_schema"));
            assertTrue(status.contains("Model type: star_schema"));
            assertTrue(status.contains("Stages: >A< B C D E F"));
            assertTrue(status.contains("Progress: 0%"));
        }
    }
}
