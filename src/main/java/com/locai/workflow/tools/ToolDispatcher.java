package com.locai.workflow.tools;

import com.locai.workflow.model.ToolResult;
import org.springframework.ai.tool.ToolCallback;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Boundary to the tool implementations.
 */
public interface ToolDispatcher {

    /**
     * Names of every tool that can be enabled for a run.
     */
    List<String> availableTools();

    /**
     * Callbacks for the enabled subset, used to advertise tool schemas to the model.
     */
    List<ToolCallback> callbacksFor(Collection<String> enabledTools);

    /**
     * Executes one tool. Never throws for tool-level problems: unknown tools and tool
     * exceptions come back as a failed {@link ToolResult}.
     *
     * @param callId       id of the originating call, copied into the result
     * @param toolName     requested tool
     * @param arguments    arguments as requested by the model
     * @param enabledTools the run's enabled tools
     * @return the result linked to {@code callId}
     */
    ToolResult dispatch(String callId, String toolName, Map<String, Object> arguments,
                        Collection<String> enabledTools);
}
