package com.qmb.core.logging;

import com.qmb.core.model.StageId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link MdcContext}.
 */
class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setSession populates session keys")
    void setSessionPopulatesKeys() {
        MdcContext.setSession("QMB-2025-0001", "Sales");

        assertEquals("QMB-2025-0001", MDC.get("sessionId"));
        assertEquals("Sales", MDC.get("projectName"));
        assertNull(MDC.get("stage"));
    }

    @Test
    @DisplayName("setStage adds the stage letter")
    void setStageAddsStage() {
        MdcContext.setStage("QMB-2025-0001", "Sales", StageId.C);

        assertEquals("C", MDC.get("stage"));
        assertEquals("QMB-2025-0001", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("clear removes only the model builder keys")
    void clearRemovesOwnKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setStage("QMB-2025-0001", "Sales", StageId.A);

        MdcContext.clear();

        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("projectName"));
        assertNull(MDC.get("stage"));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
