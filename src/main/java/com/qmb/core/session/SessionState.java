package com.qmb.core.session;

import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.BuildConfig;
import com.qmb.core.model.ModelType;
import com.qmb.core.model.SourceSpec;
import com.qmb.core.model.StageArtifact;
import com.qmb.core.model.StageId;
import com.qmb.core.model.StageState;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of everything a session owns. Mutations build a new snapshot and
 * publish it through {@link BuildSession#replaceState}, so readers never observe a
 * half-applied change.
 *
 * @param currentStage the stage the pointer is on; stays at {@code F} once complete
 * @param complete     true after stage F has been approved
 */
public record SessionState(
        SourceSpec input,
        AnalysisResult analysis,
        ModelType modelType,
        BuildConfig config,
        Map<StageId, StageArtifact> stages,
        StageId currentStage,
        boolean complete,
        Instant updatedAt
) {
    public SessionState {
        stages = Collections.unmodifiableMap(new EnumMap<>(stages));
    }

    public static SessionState initial(BuildConfig config, Instant now) {
        return new SessionState(null, null, null, config, freshStages(), StageId.A, false, now);
    }

    /** New analysis; prior stage artifacts are discarded since they were generated from the old one. */
    public SessionState withAnalysis(SourceSpec input, AnalysisResult analysis, Instant now) {
        return new SessionState(input, analysis, modelType, config, freshStages(), StageId.A, false, now);
    }

    /** New model type; every stage artifact is invalidated. */
    public SessionState withModelType(ModelType type, Instant now) {
        return new SessionState(input, analysis, type, config, freshStages(), StageId.A, false, now);
    }

    public SessionState withConfig(BuildConfig next, Instant now) {
        return new SessionState(input, analysis, modelType, next, stages, currentStage, complete, now);
    }

    public SessionState withStages(Map<StageId, StageArtifact> next, StageId pointer, boolean done, Instant now) {
        return new SessionState(input, analysis, modelType, config, next, pointer, done, now);
    }

    public StageArtifact stage(StageId id) {
        return stages.get(id);
    }

    public List<StageArtifact> approvedStages() {
        return stages.values().stream().filter(StageArtifact::approved).toList();
    }

    public int progressPercent() {
        return (int) Math.round(approvedStages().size() / (double) StageId.values().length * 100);
    }

    /**
     * Compact pipeline view: {@code [A]} approved, {@code >B<} current, {@code C*} built
     * but not approved, bare letters unbuilt.
     */
    public String stageBar() {
        StringBuilder bar = new StringBuilder();
        for (StageId id : StageId.values()) {
            if (bar.length() > 0) {
                bar.append(' ');
            }
            StageArtifact artifact = stages.get(id);
            if (artifact.approved()) {
                bar.append('[').append(id.name()).append(']');
            } else if (id == currentStage && !complete) {
                bar.append('>').append(id.name()).append(artifact.isBuilt() ? "*" : "").append('<');
            } else if (artifact.state() == StageState.BUILT) {
                bar.append(id.name()).append('*');
            } else {
                bar.append(id.name());
            }
        }
        return bar.toString();
    }

    static Map<StageId, StageArtifact> freshStages() {
        Map<StageId, StageArtifact> stages = new EnumMap<>(StageId.class);
        for (StageId id : StageId.values()) {
            stages.put(id, StageArtifact.unbuilt(id));
        }
        return stages;
    }
}
