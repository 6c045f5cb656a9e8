package com.qmb.core.logging;

import com.qmb.core.model.StageId;
import org.slf4j.MDC;

/**
 * Model builder MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId, String projectName) {
        MDC.put("sessionId", sessionId);
        MDC.put("projectName", projectName);
    }

    public static void setStage(String sessionId, String projectName, StageId stage) {
        setSession(sessionId, projectName);
        MDC.put("stage", stage.name());
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("projectName");
        MDC.remove("stage");
    }
}
