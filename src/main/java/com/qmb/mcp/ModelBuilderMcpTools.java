package com.qmb.mcp;

import com.qmb.dispatch.tools.ModelBuilderToolHandler;
import com.qmb.dispatch.tools.ToolResult;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * MCP tool methods. Each one forwards to {@link ModelBuilderToolHandler} and returns its
 * text, or throws {@link ToolInvocationException} when the call failed.
 */
@Component
public class ModelBuilderMcpTools {

    private final ModelBuilderToolHandler toolHandler;

    public ModelBuilderMcpTools(ModelBuilderToolHandler toolHandler) {
        this.toolHandler = toolHandler;
    }

    @Tool(name = "qmb_start_session", description = "Start a Qlik model builder session for a project. Suspends any active session.")
    public String startSession(@ToolParam(description = "Project name") String projectName) {
        return call("qmb_start_session", args("project_name", projectName));
    }

    @Tool(name = "qmb_status", description = "Show the active session, its stage progress bar and completion percentage")
    public String status() {
        return call("qmb_status", Map.of());
    }

    @Tool(name = "qmb_list_sessions", description = "List known model builder sessions")
    public String listSessions() {
        return call("qmb_list_sessions", Map.of());
    }

    @Tool(name = "qmb_resume_session", description = "Make a known session active again, keeping its analysis and stages")
    public String resumeSession(@ToolParam(description = "Session id, as shown by qmb_list_sessions") String sessionId) {
        return call("qmb_resume_session", args("session_id", sessionId));
    }

    @Tool(name = "qmb_find_session", description = "Find the recent session of a project, if there is one to resume")
    public String findSession(@ToolParam(description = "Project name") String projectName) {
        return call("qmb_find_session", args("project_name", projectName));
    }

    @Tool(name = "qmb_reset", description = "Discard the active session with its analysis, model type and stages")
    public String reset() {
        return call("qmb_reset", Map.of());
    }

    @Tool(name = "qmb_process_input", description = """
            Analyse source tables. Classifies each table as fact, dimension, bridge, lookup or calendar,
            resolves relationships and recommends a model type. Replaces any earlier analysis.""")
    public String processInput(
            @ToolParam(description = "Object with 'tables' (name, source_name, fields[{name,type}]) and optional 'relationship_hints' (from, to, type)")
            Map<String, Object> spec,
            @ToolParam(description = "Per-table statistics: table_name, row_count, fields[{name, type, cardinality, null_percent, sample_values, min_value, max_value}]")
            List<Map<String, Object>> samples) {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("spec", spec);
        arguments.put("samples", samples);
        return call("qmb_process_input", arguments);
    }

    @Tool(name = "qmb_get_analysis", description = "Show the classification, relationships, warnings and recommendation of the current analysis")
    public String getAnalysis() {
        return call("qmb_get_analysis", Map.of());
    }

    @Tool(name = "qmb_select_model_type", description = "Select the model type: star_schema, snowflake, link_table or normalized. Discards built stages.")
    public String selectModelType(@ToolParam(description = "Model type") String modelType) {
        return call("qmb_select_model_type", args("model_type", modelType));
    }

    @Tool(name = "qmb_update_config", description = "Update script options: qvd_path, output_path, db_path, calendar_language (EN or HE), use_autonumber")
    public String updateConfig(@ToolParam(description = "Option names to values") Map<String, Object> options) {
        return call("qmb_update_config", args("options", options));
    }

    @Tool(name = "qmb_build_stage", description = "Generate the script of the current stage, or of the given stage A-F")
    public String buildStage(@ToolParam(description = "Stage letter A-F; defaults to the current stage", required = false) String stage) {
        return call("qmb_build_stage", args("stage", stage));
    }

    @Tool(name = "qmb_approve_stage", description = "Approve the current stage and move to the next one")
    public String approveStage() {
        return call("qmb_approve_stage", Map.of());
    }

    @Tool(name = "qmb_go_back", description = "Return to an earlier stage. Later stages are discarded.")
    public String goBack(@ToolParam(description = "Stage letter A-F") String stage) {
        return call("qmb_go_back", args("stage", stage));
    }

    @Tool(name = "qmb_get_script", description = "Show the script assembled from the approved stages")
    public String getScript() {
        return call("qmb_get_script", Map.of());
    }

    @Tool(name = "qmb_validate_request", description = "Check whether a natural-language request is within the model builder's scope")
    public String validateRequest(@ToolParam(description = "The user's request") String request) {
        return call("qmb_validate_request", args("request", request));
    }

    @Tool(name = "qmb_export", description = "Package the approved script and analysis summary as JSON for deployment")
    public String export() {
        return call("qmb_export", Map.of());
    }

    @Tool(name = "qmb_audit", description = "Show the audit trail of the active session")
    public String audit() {
        return call("qmb_audit", Map.of());
    }

    @Tool(name = "qmb_help", description = "List the model builder tools and the build workflow")
    public String help() {
        return call("qmb_help", Map.of());
    }

    private String call(String tool, Map<String, Object> arguments) {
        ToolResult result = toolHandler.handle(tool, arguments);
        if (result.isError()) {
            throw new ToolInvocationException(result.errorKind(), result.text());
        }
        return result.text();
    }

    private static Map<String, Object> args(String name, Object value) {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put(name, value);
        return arguments;
    }
}
