package com.locai.workflow.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locai.config.WorkflowProperties;
import com.locai.workflow.model.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatches tool calls to the Spring AI {@link ToolCallback}s offered by every registered
 * {@link ToolCallbackProvider}. The first callback registered under a name wins.
 */
@Service
@Slf4j
public class ToolCallbackDispatcher implements ToolDispatcher {

    private final ObjectProvider<ToolCallbackProvider> providers;
    private final ToolArgumentNormalizer argumentNormalizer;
    private final ObjectMapper objectMapper;
    private final int maxOutputChars;

    public ToolCallbackDispatcher(ObjectProvider<ToolCallbackProvider> providers,
                                  ToolArgumentNormalizer argumentNormalizer,
                                  ObjectMapper objectMapper,
                                  WorkflowProperties properties) {
        this.providers = providers;
        this.argumentNormalizer = argumentNormalizer;
        this.objectMapper = objectMapper;
        this.maxOutputChars = properties.getMaxToolOutputChars();
    }

    @Override
    public List<String> availableTools() {
        return List.copyOf(registeredCallbacks().keySet());
    }

    @Override
    public List<ToolCallback> callbacksFor(Collection<String> enabledTools) {
        ToolCallbackProvider all = () -> registeredCallbacks().values().toArray(ToolCallback[]::new);
        return Arrays.asList(new FilteringToolCallbackProvider(all, enabledTools).getToolCallbacks());
    }

    @Override
    public ToolResult dispatch(String callId, String toolName, Map<String, Object> arguments,
                               Collection<String> enabledTools) {
        Optional<ToolCallback> callback = callbacksFor(enabledTools).stream()
                .filter(candidate -> matches(candidate, toolName))
                .findFirst();
        if (callback.isEmpty()) {
            log.warn("Tool call rejected: name={} is not an enabled tool", toolName);
            return ToolResult.failed(callId, "Unknown tool: " + toolName);
        }
        String matchedName = FilteringToolCallbackProvider.toolName(callback.get());
        Map<String, Object> normalized = argumentNormalizer.normalize(matchedName, arguments);
        long started = System.currentTimeMillis();
        try {
            String input = objectMapper.writeValueAsString(normalized);
            String output = callback.get().call(input);
            log.info("Tool call: name={}, durationMs={}, outputChars={}", toolName,
                    System.currentTimeMillis() - started, output == null ? 0 : output.length());
            return ToolResult.succeeded(callId, truncate(output));
        } catch (Exception ex) {
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.warn("Tool call failed: name={}, error={}", toolName, message);
            return ToolResult.failed(callId, message);
        }
    }

    private boolean matches(ToolCallback callback, String toolName) {
        String name = FilteringToolCallbackProvider.toolName(callback);
        return name.equalsIgnoreCase(toolName)
                || FilteringToolCallbackProvider.stripPrefix(name).equalsIgnoreCase(toolName);
    }

    private Map<String, ToolCallback> registeredCallbacks() {
        Map<String, ToolCallback> byName = new LinkedHashMap<>();
        providers.orderedStream()
                .flatMap(provider -> Arrays.stream(provider.getToolCallbacks()))
                .forEach(callback -> {
                    String name = FilteringToolCallbackProvider.toolName(callback);
                    if (!name.isEmpty()) {
                        byName.putIfAbsent(name, callback);
                    }
                });
        return byName;
    }

    private String truncate(String output) {
        if (output == null) {
            return "";
        }
        if (output.length() <= maxOutputChars) {
            return output;
        }
        return output.substring(0, maxOutputChars) + "\n... (truncated)";
    }
}
