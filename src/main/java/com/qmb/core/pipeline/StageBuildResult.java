package com.qmb.core.pipeline;

import com.qmb.core.model.StageArtifact;

/**
 * @param preview assembled approved stages plus this draft; only set for the final stage
 */
public record StageBuildResult(StageArtifact artifact, String preview) {}
