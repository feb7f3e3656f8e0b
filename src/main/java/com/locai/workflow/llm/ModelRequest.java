package com.locai.workflow.llm;

import org.springframework.ai.tool.ToolCallback;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * One model call. {@code tools} are advertised to the model only; the caller executes them.
 *
 * @param purpose short label used in logs (planning, step, reflection, final-answer)
 * @param host    endpoint override, {@code null} for the configured endpoint
 */
public record ModelRequest(
        String purpose,
        String model,
        @Nullable String host,
        List<ModelMessage> messages,
        List<ToolCallback> tools
) {
    public ModelRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static ModelRequest withoutTools(String purpose, String model, @Nullable String host,
                                            List<ModelMessage> messages) {
        return new ModelRequest(purpose, model, host, messages, List.of());
    }
}
