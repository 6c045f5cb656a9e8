package com.qmb.dispatch.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qmb.core.analysis.InputAnalyzer;
import com.qmb.core.error.ErrorKind;
import com.qmb.core.error.ModelBuilderException;
import com.qmb.core.error.ValidationException;
import com.qmb.core.error.WorkflowException;
import com.qmb.core.export.ExportPackager;
import com.qmb.core.export.ExportSnapshot;
import com.qmb.core.logging.AuditTrail;
import com.qmb.core.metrics.ModelBuilderMetrics;
import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.SampledStats;
import com.qmb.core.model.SourceSpec;
import com.qmb.core.model.StageId;
import com.qmb.core.pipeline.ModelTypeSelector;
import com.qmb.core.pipeline.StagePipeline;
import com.qmb.core.scope.ScopeDecision;
import com.qmb.core.scope.ScopeValidator;
import com.qmb.core.session.BuildSession;
import com.qmb.core.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches named model builder tool calls to the core and renders the outcome as a
 * {@link ToolResult}. Core failures become tagged error results; nothing escapes as an
 * exception.
 */
@Service
public class ModelBuilderToolHandler {

    private static final Logger log = LoggerFactory.getLogger(ModelBuilderToolHandler.class);

    public static final List<ToolDescriptor> TOOLS = List.of(
            new ToolDescriptor("qmb_start_session", List.of("project_name"),
                    "Start a new build session, suspending the active one"),
            new ToolDescriptor("qmb_status", List.of(), "Show the active session and stage progress"),
            new ToolDescriptor("qmb_list_sessions", List.of(), "List known sessions"),
            new ToolDescriptor("qmb_resume_session", List.of("session_id"), "Make a known session active again"),
            new ToolDescriptor("qmb_find_session", List.of("project_name"), "Find a recent session of a project"),
            new ToolDescriptor("qmb_reset", List.of(), "Discard the active session"),
            new ToolDescriptor("qmb_process_input", List.of("spec", "samples"),
                    "Analyse table declarations and sampled statistics"),
            new ToolDescriptor("qmb_get_analysis", List.of(), "Show the current analysis"),
            new ToolDescriptor("qmb_select_model_type", List.of("model_type"),
                    "Choose star_schema, snowflake, link_table or normalized"),
            new ToolDescriptor("qmb_update_config", List.of("options"),
                    "Set qvd_path, output_path, db_path, calendar_language or use_autonumber"),
            new ToolDescriptor("qmb_build_stage", List.of("stage?"),
                    "Generate the current stage, or the given one"),
            new ToolDescriptor("qmb_approve_stage", List.of(), "Approve the current stage and advance"),
            new ToolDescriptor("qmb_go_back", List.of("stage"), "Return to an earlier stage"),
            new ToolDescriptor("qmb_get_script", List.of(), "Show the approved script"),
            new ToolDescriptor("qmb_validate_request", List.of("request"),
                    "Check whether a request is within the builder's scope"),
            new ToolDescriptor("qmb_export", List.of(), "Package the approved script for deployment"),
            new ToolDescriptor("qmb_audit", List.of(), "Show the audit trail of the active session"),
            new ToolDescriptor("qmb_help", List.of(), "Show this help"));

    private static final TypeReference<List<SampledStats>> SAMPLES_TYPE = new TypeReference<>() {};

    private final SessionStore sessionStore;
    private final InputAnalyzer inputAnalyzer;
    private final ModelTypeSelector modelTypeSelector;
    private final StagePipeline stagePipeline;
    private final ExportPackager exportPackager;
    private final AuditTrail auditTrail;
    private final ModelBuilderMetrics metrics;
    private final ObjectMapper objectMapper;

    public ModelBuilderToolHandler(SessionStore sessionStore,
                                   InputAnalyzer inputAnalyzer,
                                   ModelTypeSelector modelTypeSelector,
                                   StagePipeline stagePipeline,
                                   ExportPackager exportPackager,
                                   AuditTrail auditTrail,
                                   ModelBuilderMetrics metrics,
                                   ObjectMapper objectMapper) {
        this.sessionStore = sessionStore;
        this.inputAnalyzer = inputAnalyzer;
        this.modelTypeSelector = modelTypeSelector;
        this.stagePipeline = stagePipeline;
        this.exportPackager = exportPackager;
        this.auditTrail = auditTrail;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    public ToolResult handle(String toolName, Map<String, Object> args) {
        Map<String, Object> arguments = args != null ? args : Map.of();
        log.debug("Tool call {} with argument(s) {}", toolName, arguments.keySet());
        try {
            String text = dispatch(toolName, arguments);
            if (text == null) {
                metrics.recordToolError(ErrorKind.UNKNOWN_OPERATION);
                log.warn("Unknown model builder tool: {}", toolName);
                return ToolResult.error(ErrorKind.UNKNOWN_OPERATION, "Unknown model builder tool: " + toolName);
            }
            return ToolResult.ok(text);
        } catch (ModelBuilderException e) {
            metrics.recordToolError(e.getKind());
            log.info("Tool {} failed ({}): {}", toolName, e.getKind(), e.getMessage());
            return ToolResult.error(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            metrics.recordToolError(ErrorKind.INTERNAL);
            log.error("Tool {} failed unexpectedly", toolName, e);
            return ToolResult.error(ErrorKind.INTERNAL, "Internal error in " + toolName + ": "
                    + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
    }

    /** Returns {@code null} for an unknown tool name. */
    private String dispatch(String toolName, Map<String, Object> args) {
        return switch (toolName == null ? "" : toolName) {
            case "qmb_start_session" -> ToolResponses.started(sessionStore.start(string(args, "project_name")));
            case "qmb_status" -> sessionStore.status();
            case "qmb_list_sessions" -> ToolResponses.sessions(sessionStore.list());
            case "qmb_resume_session" -> ToolResponses.resumed(sessionStore.resume(requireString(args, "session_id")));
            case "qmb_find_session" -> {
                String projectName = requireString(args, "project_name");
                yield ToolResponses.found(projectName, sessionStore.findRecent(projectName));
            }
            case "qmb_reset" -> ToolResponses.reset(sessionStore.reset());
            case "qmb_process_input" -> processInput(args);
            case "qmb_get_analysis" -> ToolResponses.analysis(currentAnalysis());
            case "qmb_select_model_type" -> ToolResponses.selection(
                    modelTypeSelector.selectModelType(requireString(args, "model_type")));
            case "qmb_update_config" -> ToolResponses.config(modelTypeSelector.updateConfig(options(args)));
            case "qmb_build_stage" -> {
                String stage = string(args, "stage");
                yield ToolResponses.built(stagePipeline.build(stage == null || stage.isBlank() ? null : StageId.parse(stage)));
            }
            case "qmb_approve_stage" -> ToolResponses.approved(stagePipeline.approve());
            case "qmb_go_back" -> ToolResponses.reverted(stagePipeline.goBack(StageId.parse(requireString(args, "stage"))));
            case "qmb_get_script" -> stagePipeline.getScript();
            case "qmb_validate_request" -> validateRequest(requireString(args, "request"));
            case "qmb_export" -> export();
            case "qmb_audit" -> {
                BuildSession session = sessionStore.requireActive();
                yield ToolResponses.audit(session.getId(), auditTrail.history(session.getId()));
            }
            case "qmb_help" -> ToolResponses.help(TOOLS);
            default -> null;
        };
    }

    private String processInput(Map<String, Object> args) {
        SourceSpec spec = convert(args.get("spec"), "spec", SourceSpec.class);
        List<SampledStats> samples = convertSamples(args.get("samples"));
        return ToolResponses.analysis(inputAnalyzer.processInput(spec, samples));
    }

    private AnalysisResult currentAnalysis() {
        AnalysisResult analysis = sessionStore.requireActive().state().analysis();
        if (analysis == null) {
            throw new WorkflowException("No analysis available. Call qmb_process_input first.");
        }
        return analysis;
    }

    private String validateRequest(String request) {
        ScopeDecision decision = ScopeValidator.validate(request);
        metrics.recordScopeDecision(decision.allowed());
        return ToolResponses.scope(decision);
    }

    private String export() {
        ExportSnapshot snapshot = exportPackager.export();
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise export snapshot", e);
        }
    }

    private <T> T convert(Object value, String name, Class<T> type) {
        if (value == null) {
            return null;
        }
        try {
            if (value instanceof String json) {
                return objectMapper.readValue(json, type);
            }
            return objectMapper.convertValue(value, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValidationException("Invalid " + name + ": " + e.getMessage());
        }
    }

    private List<SampledStats> convertSamples(Object value) {
        if (value == null) {
            return null;
        }
        try {
            if (value instanceof String json) {
                return objectMapper.readValue(json, SAMPLES_TYPE);
            }
            return objectMapper.convertValue(value, SAMPLES_TYPE);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValidationException("Invalid samples: " + e.getMessage());
        }
    }

    private static Map<String, Object> options(Map<String, Object> args) {
        Object value = args.get("options");
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> options = new LinkedHashMap<>();
            map.forEach((key, option) -> options.put(String.valueOf(key), option));
            return options;
        }
        throw new ValidationException("options must be an object of option names to values");
    }

    private static String string(Map<String, Object> args, String name) {
        Object value = args.get(name);
        return value == null ? null : value.toString();
    }

    private static String requireString(Map<String, Object> args, String name) {
        String value = string(args, name);
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required argument: " + name);
        }
        return value;
    }
}
