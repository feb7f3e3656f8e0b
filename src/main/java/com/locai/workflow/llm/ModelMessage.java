package com.locai.workflow.llm;

import org.springframework.lang.Nullable;

import java.util.List;

public record ModelMessage(
        Role role,
        String content,
        List<ModelToolCall> toolCalls,
        @Nullable String toolCallId,
        @Nullable String toolName
) {
    public enum Role {
        SYSTEM,
        USER,
        ASSISTANT,
        TOOL
    }

    public ModelMessage {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ModelMessage system(String content) {
        return new ModelMessage(Role.SYSTEM, content, List.of(), null, null);
    }

    public static ModelMessage user(String content) {
        return new ModelMessage(Role.USER, content, List.of(), null, null);
    }

    public static ModelMessage assistant(String content) {
        return new ModelMessage(Role.ASSISTANT, content, List.of(), null, null);
    }

    public static ModelMessage assistant(String content, List<ModelToolCall> toolCalls) {
        return new ModelMessage(Role.ASSISTANT, content, toolCalls, null, null);
    }

    public static ModelMessage toolResult(String toolCallId, String toolName, String content) {
        return new ModelMessage(Role.TOOL, content, List.of(), toolCallId, toolName);
    }
}
