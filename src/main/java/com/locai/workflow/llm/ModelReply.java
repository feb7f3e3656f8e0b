package com.locai.workflow.llm;

import java.util.List;

public record ModelReply(String content, List<ModelToolCall> toolCalls) {

    public ModelReply {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ModelReply text(String content) {
        return new ModelReply(content, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
