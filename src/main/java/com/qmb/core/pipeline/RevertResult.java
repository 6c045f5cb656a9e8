package com.qmb.core.pipeline;

import com.qmb.core.model.StageId;

import java.util.List;

/**
 * @param invalidated later stages whose built or approved text was discarded
 */
public record RevertResult(StageId stage, List<StageId> invalidated) {}
