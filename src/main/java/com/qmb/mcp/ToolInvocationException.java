package com.qmb.mcp;

import com.qmb.core.error.ErrorKind;

/**
 * Raised from an MCP tool method when the model builder reports an error, so the MCP
 * response is flagged {@code isError}.
 */
public class ToolInvocationException extends RuntimeException {

    private final ErrorKind kind;

    public ToolInvocationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
