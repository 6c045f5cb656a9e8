package com.qmb.core.script;

import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.BuildConfig;
import com.qmb.core.model.ModelType;
import com.qmb.core.model.StageArtifact;

import java.time.Instant;
import java.util.List;

/**
 * Everything a fragment builder may read. Builders never see the session itself.
 *
 * @param approvedStages currently approved artifacts in stage order
 */
public record BuildContext(
        String projectName,
        AnalysisResult analysis,
        ModelType modelType,
        BuildConfig config,
        List<StageArtifact> approvedStages,
        Instant now
) {
    public BuildContext {
        approvedStages = List.copyOf(approvedStages);
    }

    public KeyPlan keys() {
        return KeyPlan.of(analysis);
    }
}
