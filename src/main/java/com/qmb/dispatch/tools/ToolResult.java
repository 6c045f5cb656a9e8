package com.qmb.dispatch.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qmb.core.error.ErrorKind;

/**
 * Human-readable outcome of a tool call, explicitly tagged so a calling agent can branch
 * on {@code isError} without parsing the text.
 *
 * @param errorKind failure category, {@code null} on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
        @JsonProperty("text") String text,
        @JsonProperty("is_error") boolean isError,
        @JsonProperty("error_kind") ErrorKind errorKind
) {
    public static ToolResult ok(String text) {
        return new ToolResult(text, false, null);
    }

    public static ToolResult error(ErrorKind kind, String text) {
        return new ToolResult(text, true, kind);
    }
}
