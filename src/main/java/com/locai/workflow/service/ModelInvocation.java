package com.locai.workflow.service;

import com.locai.workflow.llm.ModelMessage;
import com.locai.workflow.llm.ModelRequest;
import com.locai.workflow.runtime.RunContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * What every model call of one run shares: model, endpoint, leading messages and the run context.
 */
public record ModelInvocation(
        String model,
        @Nullable String host,
        List<ModelMessage> baseMessages,
        RunContext runContext
) {
    public ModelInvocation {
        baseMessages = baseMessages == null ? List.of() : List.copyOf(baseMessages);
    }

    public ModelRequest request(String purpose, String userPrompt) {
        return request(purpose, userPrompt, List.of());
    }

    public ModelRequest request(String purpose, String userPrompt, List<ToolCallback> tools) {
        List<ModelMessage> messages = new ArrayList<>(baseMessages);
        messages.add(ModelMessage.user(userPrompt));
        return new ModelRequest(purpose, model, host, messages, tools);
    }

    public ModelRequest request(String purpose, List<ModelMessage> conversation, List<ToolCallback> tools) {
        return new ModelRequest(purpose, model, host, conversation, tools);
    }
}
