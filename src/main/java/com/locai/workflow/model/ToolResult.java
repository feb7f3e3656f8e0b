package com.locai.workflow.model;

import org.springframework.lang.Nullable;

/**
 * Outcome of one {@link ToolCall}, linked by {@code callId}.
 */
public record ToolResult(
        String callId,
        boolean success,
        String content,
        @Nullable String error
) {
    public static ToolResult succeeded(String callId, String content) {
        return new ToolResult(callId, true, content == null ? "" : content, null);
    }

    public static ToolResult failed(String callId, String error) {
        String message = error == null || error.isBlank() ? "Tool execution failed" : error;
        return new ToolResult(callId, false, "", message);
    }
}
