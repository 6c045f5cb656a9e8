package com.qmb.core.session;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Read-only description of a known session, used by {@code list}.
 */
public record SessionSummary(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("project_name") String projectName,
        @JsonProperty("status") SessionStatus status,
        @JsonProperty("model_type") String modelType,
        @JsonProperty("current_stage") String currentStage,
        @JsonProperty("progress_percent") int progressPercent,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {}
