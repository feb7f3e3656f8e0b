package com.locai.workflow.llm;

import java.util.function.Consumer;

/**
 * Boundary to the language model serving endpoint.
 */
public interface ModelClient {

    /**
     * Performs a blocking call and returns the free text and/or the tool calls requested by the model.
     *
     * @param request the messages, model and advertised tools
     * @return the model reply, never {@code null}
     */
    ModelReply chat(ModelRequest request);

    /**
     * Streams a text completion, handing each delta to {@code onDelta} as it arrives.
     * An exception thrown by {@code onDelta} stops the stream and propagates.
     *
     * @param request the messages and model, tools are ignored
     * @param onDelta receiver of content deltas
     * @return the full concatenated text
     */
    String stream(ModelRequest request, Consumer<String> onDelta);
}
