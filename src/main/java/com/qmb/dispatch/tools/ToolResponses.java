package com.qmb.dispatch.tools;

import com.qmb.core.events.ModelBuilderEvent;
import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.AnalysisWarning;
import com.qmb.core.model.ModelType;
import com.qmb.core.model.RelationshipEdge;
import com.qmb.core.model.StageArtifact;
import com.qmb.core.model.TableAnalysis;
import com.qmb.core.pipeline.ApprovalResult;
import com.qmb.core.pipeline.ConfigUpdate;
import com.qmb.core.pipeline.ModelTypeSelection;
import com.qmb.core.pipeline.RevertResult;
import com.qmb.core.pipeline.StageBuildResult;
import com.qmb.core.scope.ScopeDecision;
import com.qmb.core.session.BuildSession;
import com.qmb.core.session.SessionState;
import com.qmb.core.session.SessionSummary;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Text rendering of tool results. Shared by the tool handler and the CLI.
 */
public final class ToolResponses {

    private ToolResponses() {} // utility class

    public static String started(BuildSession session) {
        return "Session " + session.getId() + " started for project '" + session.getProjectName() + "'.\n"
                + "Next: call qmb_process_input with the table spec and sampled statistics.";
    }

    public static String sessions(List<SessionSummary> summaries) {
        if (summaries.isEmpty()) {
            return "No sessions yet.";
        }
        StringBuilder sb = new StringBuilder("Sessions (" + summaries.size() + "):");
        for (SessionSummary s : summaries) {
            sb.append("\n  ").append(s.sessionId()).append("  ").append(s.projectName())
                    .append("  ").append(s.status().name().toLowerCase(Locale.ROOT))
                    .append("  model=").append(s.modelType() != null ? s.modelType() : "-")
                    .append("  stage=").append(s.currentStage())
                    .append("  ").append(s.progressPercent()).append('%');
        }
        return sb.toString();
    }

    public static String resumed(BuildSession session) {
        SessionState state = session.state();
        return "Session " + session.getId() + " resumed for project '" + session.getProjectName() + "'.\n"
                + "Model type: " + (state.modelType() != null ? state.modelType().wireName() : "not selected") + "\n"
                + "Stages: " + state.stageBar() + "\n"
                + "Progress: " + state.progressPercent() + "%" + (state.complete() ? " (complete)" : "");
    }

    public static String found(String projectName, Optional<SessionSummary> recent) {
        if (recent.isEmpty()) {
            return "No recent session for project '" + projectName + "'. Start one with qmb_start_session.";
        }
        SessionSummary s = recent.get();
        return "Found session " + s.sessionId() + " for project '" + s.projectName() + "'.\n"
                + "Status: " + s.status().name().toLowerCase(Locale.ROOT)
                + ", stage " + s.currentStage() + ", " + s.progressPercent() + "%, last updated " + s.updatedAt() + "\n"
                + "Continue it with qmb_resume_session.";
    }

    public static String reset(SessionSummary summary) {
        return "Session " + summary.sessionId() + " for project '" + summary.projectName()
                + "' has been reset. Analysis, model type and stages were discarded.";
    }

    public static String analysis(AnalysisResult analysis) {
        StringBuilder sb = new StringBuilder();
        sb.append("Analysed ").append(analysis.tables().size()).append(" table(s)\n\nTables:");
        for (TableAnalysis table : analysis.tables()) {
            sb.append("\n  ").append(table.name()).append(": ").append(table.classification().wireName())
                    .append(" (confidence ").append(percent(table.confidence())).append(')');
            if (table.hasStats()) {
                sb.append(", ").append(table.rowCount()).append(" rows");
            }
            if (table.primaryKey() != null) {
                sb.append(", PK ").append(table.primaryKey());
            }
            if (!table.foreignKeys().isEmpty()) {
                sb.append(", FK ").append(String.join(", ", table.foreignKeys()));
            }
        }
        sb.append("\n\nRelationships:");
        if (analysis.relationships().isEmpty()) {
            sb.append("\n  (none)");
        }
        for (RelationshipEdge edge : analysis.relationships()) {
            sb.append("\n  ").append(edge.describe())
                    .append(" [").append(edge.source().name().toLowerCase(Locale.ROOT))
                    .append(", ").append(percent(edge.confidence())).append(']');
        }
        if (!analysis.unresolved().isEmpty()) {
            sb.append("\n\nUnresolved:");
            analysis.unresolved().forEach(u -> sb.append("\n  ").append(u));
        }
        if (!analysis.warnings().isEmpty()) {
            sb.append("\n\nWarnings:");
            for (AnalysisWarning warning : analysis.warnings()) {
                sb.append("\n  [").append(warning.type()).append("] ").append(warning.message());
            }
        }
        sb.append("\n\nRecommended model type: ").append(analysis.recommendation().modelType().wireName())
                .append(" (confidence ").append(percent(analysis.recommendation().confidence())).append(")\n")
                .append("Rationale: ").append(analysis.recommendation().rationale());
        if (!analysis.recommendation().alternatives().isEmpty()) {
            sb.append("\nAlternatives: ").append(analysis.recommendation().alternatives().stream()
                    .map(ModelType::wireName).collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }

    public static String selection(ModelTypeSelection selection) {
        StringBuilder sb = new StringBuilder("Model type set to ")
                .append(selection.chosen().wireName()).append(" (").append(selection.chosen().displayName()).append(").");
        if (!selection.followsRecommendation()) {
            sb.append("\nNote: the analysis recommended ").append(selection.recommended().wireName()).append('.');
        }
        if (selection.invalidatedStages() > 0) {
            sb.append("\n").append(selection.invalidatedStages()).append(" previously built stage(s) were discarded.");
        }
        sb.append("\nNext: call qmb_build_stage to generate stage A.");
        return sb.toString();
    }

    public static String config(ConfigUpdate update) {
        StringBuilder sb = new StringBuilder();
        sb.append(update.applied().isEmpty() ? "No configuration options changed."
                : "Updated: " + String.join(", ", update.applied()));
        if (!update.ignored().isEmpty()) {
            sb.append("\nIgnored unrecognised option(s): ").append(String.join(", ", update.ignored()));
        }
        sb.append("\n\nCurrent configuration:")
                .append("\n  qvd_path: ").append(update.config().qvdPath())
                .append("\n  output_path: ").append(update.config().outputPath())
                .append("\n  db_path: ").append(update.config().dbPath())
                .append("\n  calendar_language: ").append(update.config().calendarLanguage())
                .append("\n  use_autonumber: ").append(update.config().useAutonumber());
        return sb.toString();
    }

    public static String built(StageBuildResult result) {
        StageArtifact artifact = result.artifact();
        StringBuilder sb = new StringBuilder("Stage ").append(artifact.stageId().label()).append(" built");
        if (!artifact.tables().isEmpty()) {
            sb.append(" (tables: ").append(String.join(", ", artifact.tables())).append(')');
        }
        sb.append(".\n\n").append(result.preview() != null ? result.preview() : artifact.script());
        sb.append("\n\nReview the script, then call qmb_approve_stage or rebuild with qmb_build_stage.");
        return sb.toString();
    }

    public static String approved(ApprovalResult result) {
        StringBuilder sb = new StringBuilder("Stage ").append(result.approved().label()).append(" approved. Progress: ")
                .append(result.progressPercent()).append('%');
        if (result.complete()) {
            sb.append("\nAll stages approved. The model is complete; call qmb_get_script or qmb_export.");
        } else {
            sb.append("\nNext: stage ").append(result.nextStage().label()).append(". Call qmb_build_stage.");
        }
        return sb.toString();
    }

    public static String reverted(RevertResult result) {
        StringBuilder sb = new StringBuilder("Moved back to stage ").append(result.stage().label()).append('.');
        if (!result.invalidated().isEmpty()) {
            sb.append("\nDiscarded stage(s): ").append(result.invalidated().stream()
                    .map(Enum::name).collect(Collectors.joining(", ")));
        }
        sb.append("\nRebuild with qmb_build_stage.");
        return sb.toString();
    }

    public static String scope(ScopeDecision decision) {
        StringBuilder sb = new StringBuilder(decision.allowed() ? "ALLOWED" : "BLOCKED");
        if (decision.intent() != null) {
            sb.append("\nIntent: ").append(decision.intent());
        }
        sb.append("\nConfidence: ").append(percent(decision.confidence()));
        if (!decision.matchedKeywords().isEmpty()) {
            sb.append("\nKeywords: ").append(String.join(", ", decision.matchedKeywords()));
        }
        sb.append("\nReason: ").append(decision.reason())
                .append('\n').append(decision.message());
        return sb.toString();
    }

    public static String audit(String sessionId, List<ModelBuilderEvent> events) {
        if (events.isEmpty()) {
            return "No audit entries for session " + sessionId + ".";
        }
        StringBuilder sb = new StringBuilder("Audit trail for ").append(sessionId).append(':');
        for (ModelBuilderEvent event : events) {
            sb.append("\n  ").append(event.timestamp()).append("  ").append(event.eventType());
            if (event.stage() != null) {
                sb.append(" [").append(event.stage()).append(']');
            }
            if (event.payload() != null && !event.payload().isEmpty()) {
                sb.append("  ").append(event.payload());
            }
        }
        return sb.toString();
    }

    public static String help(List<ToolDescriptor> tools) {
        StringBuilder sb = new StringBuilder("Qlik model builder tools:");
        for (ToolDescriptor tool : tools) {
            sb.append("\n  ").append(tool.signature()).append("\n      ").append(tool.description());
        }
        sb.append("\n\nWorkflow: start session -> process input -> select model type -> ")
                .append("build and approve stages A to F -> get script or export.");
        return sb.toString();
    }

    static String percent(double value) {
        return Math.round(value * 100) + "%";
    }
}
