package com.locai.workflow.model;

import java.time.Instant;
import java.util.Map;

public record ToolCall(
        String id,
        String name,
        Map<String, Object> arguments,
        String stepId,
        int callIndex,
        Instant startedAt
) {
    public ToolCall {
        arguments = arguments == null ? Map.of() : arguments;
    }
}
