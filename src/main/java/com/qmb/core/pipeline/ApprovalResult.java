package com.qmb.core.pipeline;

import com.qmb.core.model.StageId;

/**
 * @param nextStage stage the pointer moved to, or {@code null} once the pipeline is complete
 */
public record ApprovalResult(StageId approved, StageId nextStage, int progressPercent, boolean complete) {}
