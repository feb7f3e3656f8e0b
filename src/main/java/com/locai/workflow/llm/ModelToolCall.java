package com.locai.workflow.llm;

import java.util.Map;

/**
 * A tool invocation requested by the model.
 */
public record ModelToolCall(String id, String name, Map<String, Object> arguments) {

    public ModelToolCall {
        arguments = arguments == null ? Map.of() : arguments;
    }
}
