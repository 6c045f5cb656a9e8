package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Generated script fragment of one stage together with its approval state.
 *
 * @param tables script table names loaded by this fragment
 */
public record StageArtifact(
        @JsonProperty("stage_id") StageId stageId,
        @JsonProperty("state") StageState state,
        @JsonProperty("script") String script,
        @JsonProperty("tables") List<String> tables,
        @JsonProperty("built_at") Instant builtAt,
        @JsonProperty("approved_at") Instant approvedAt
) {
    public StageArtifact {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }

    public static StageArtifact unbuilt(StageId stageId) {
        return new StageArtifact(stageId, StageState.UNBUILT, null, List.of(), null, null);
    }

    public static StageArtifact built(StageId stageId, String script, List<String> tables, Instant builtAt) {
        return new StageArtifact(stageId, StageState.BUILT, script, tables, builtAt, null);
    }

    public StageArtifact approve(Instant at) {
        return new StageArtifact(stageId, StageState.APPROVED, script, tables, builtAt, at);
    }

    public boolean approved() {
        return state == StageState.APPROVED;
    }

    public boolean isBuilt() {
        return state != StageState.UNBUILT;
    }
}
