package com.qmb.dispatch.api;

import com.qmb.core.session.SessionStore;
import com.qmb.core.session.SessionSummary;
import com.qmb.dispatch.tools.ModelBuilderToolHandler;
import com.qmb.dispatch.tools.ToolResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST surface of the model builder tools.
 */
@RestController
@RequestMapping("/api/v1/model-builder")
public class ModelBuilderController {

    private final ModelBuilderToolHandler toolHandler;
    private final SessionStore sessionStore;

    public ModelBuilderController(ModelBuilderToolHandler toolHandler, SessionStore sessionStore) {
        this.toolHandler = toolHandler;
        this.sessionStore = sessionStore;
    }

    /**
     * POST /api/v1/model-builder/tools/{tool}: Invoke a tool with a JSON object of arguments.
     */
    @PostMapping("/tools/{tool}")
    public ResponseEntity<ToolResult> invoke(@PathVariable String tool,
                                             @RequestBody(required = false) Map<String, Object> arguments) {
        ToolResult result = toolHandler.handle(tool, arguments != null ? arguments : Map.of());
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    /**
     * GET /api/v1/model-builder/sessions: Known sessions, most recently updated first.
     */
    @GetMapping("/sessions")
    public ResponseEntity<List<SessionSummary>> sessions() {
        return ResponseEntity.ok(sessionStore.list());
    }

    /**
     * GET /api/v1/model-builder/status: Status of the active session.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "active", sessionStore.active().isPresent(),
                "status", sessionStore.status()));
    }

    static HttpStatus statusOf(ToolResult result) {
        if (!result.isError()) {
            return HttpStatus.OK;
        }
        return switch (result.errorKind()) {
            case UNKNOWN_OPERATION -> HttpStatus.NOT_FOUND;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
            case VALIDATION, SESSION, WORKFLOW -> HttpStatus.BAD_REQUEST;
        };
    }
}
