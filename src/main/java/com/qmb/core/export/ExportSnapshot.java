package com.qmb.core.export;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Immutable hand-off package for a deployment collaborator.
 */
public record ExportSnapshot(
        @JsonProperty("version") String version,
        @JsonProperty("project_name") String projectName,
        @JsonProperty("model_type") String modelType,
        @JsonProperty("assembled_script") String assembledScript,
        @JsonProperty("analysis_summary") AnalysisSummary analysisSummary,
        @JsonProperty("facts") List<FactEntry> facts,
        @JsonProperty("dimensions") List<DimensionEntry> dimensions,
        @JsonProperty("calendars") List<CalendarEntry> calendars,
        @JsonProperty("approved_stages") List<String> approvedStages,
        @JsonProperty("complete") boolean complete,
        @JsonProperty("exported_at") Instant exportedAt
) {
    public static final String FORMAT_VERSION = "1.0.0";

    public ExportSnapshot {
        facts = List.copyOf(facts);
        dimensions = List.copyOf(dimensions);
        calendars = List.copyOf(calendars);
        approvedStages = List.copyOf(approvedStages);
    }

    public record AnalysisSummary(
            @JsonProperty("table_count") int tableCount,
            @JsonProperty("facts") int facts,
            @JsonProperty("dimensions") int dimensions,
            @JsonProperty("bridges") int bridges,
            @JsonProperty("lookups") int lookups,
            @JsonProperty("calendars") int calendars,
            @JsonProperty("relationships") int relationships,
            @JsonProperty("recommended_model_type") String recommendedModelType,
            @JsonProperty("recommendation_confidence") double recommendationConfidence
    ) {}

    public record FactEntry(
            @JsonProperty("name") String name,
            @JsonProperty("keys") List<String> keys,
            @JsonProperty("measures") List<String> measures
    ) {}

    public record DimensionEntry(
            @JsonProperty("name") String name,
            @JsonProperty("primary_key") String primaryKey,
            @JsonProperty("attributes") List<String> attributes
    ) {}

    /**
     * @param minDate ISO date, first day the calendar covers
     * @param maxDate ISO date, last day the calendar covers
     */
    public record CalendarEntry(
            @JsonProperty("name") String name,
            @JsonProperty("date_field") String dateField,
            @JsonProperty("min_date") String minDate,
            @JsonProperty("max_date") String maxDate
    ) {}
}
