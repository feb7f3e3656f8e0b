package com.locai.workflow.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locai.config.WorkflowProperties;
import com.locai.workflow.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ToolCallbackDispatcherTest {

    private ToolCallback writeFile;
    private ToolCallback webSearch;
    private ToolCallbackDispatcher dispatcher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        writeFile = callback("fs.write_file");
        webSearch = callback("web_search");
        ToolCallback shadowed = callback("web_search");
        when(shadowed.call(anyString())).thenReturn("shadowed");

        ToolCallbackProvider first = () -> new ToolCallback[]{writeFile, webSearch};
        ToolCallbackProvider second = () -> new ToolCallback[]{shadowed};
        ObjectProvider<ToolCallbackProvider> providers = mock(ObjectProvider.class);
        when(providers.orderedStream()).thenAnswer(invocation -> Stream.of(first, second));

        WorkflowProperties properties = new WorkflowProperties();
        properties.setMaxToolOutputChars(20);
        dispatcher = new ToolCallbackDispatcher(providers, new ToolArgumentNormalizer(), new ObjectMapper(),
                properties);
    }

    @Test
    void testAvailableToolsKeepsFirstRegistration() {
        assertEquals(List.of("fs.write_file", "web_search"), dispatcher.availableTools());
    }

    @Test
    void testCallbacksForFiltersByEnabledNames() {
        assertEquals(List.of(writeFile), dispatcher.callbacksFor(List.of("WRITE_FILE")));
        assertTrue(dispatcher.callbacksFor(List.of()).isEmpty());
    }

    @Test
    void testDispatchNormalizesArgumentsAndLinksResult() {
        when(writeFile.call(anyString())).thenReturn("ok");

        ToolResult result = dispatcher.dispatch("call-1", "write_file",
                Map.of("filename", "notes.md", "text", "hello"), List.of("write_file"));

        assertTrue(result.success());
        assertEquals("call-1", result.callId());
        assertEquals("ok", result.content());
        verify(writeFile).call("{\"path\":\"notes.md\",\"content\":\"hello\"}");
    }

    @Test
    void testDispatchNormalizesByMatchedToolName() {
        when(writeFile.call(anyString())).thenReturn("ok");

        ToolResult result = dispatcher.dispatch("call-5", "Write_File", Map.of("filename", "a.txt"),
                List.of("write_file"));

        assertTrue(result.success());
        verify(writeFile).call("{\"path\":\"a.txt\"}");
    }

    @Test
    void testDisabledToolIsRejectedWithoutCall() {
        ToolResult result = dispatcher.dispatch("call-2", "web_search", Map.of("query", "x"), List.of("write_file"));

        assertFalse(result.success());
        assertEquals("Unknown tool: web_search", result.error());
        verify(webSearch, never()).call(anyString());
    }

    @Test
    void testToolExceptionBecomesFailedResult() {
        when(webSearch.call(anyString())).thenThrow(new IllegalStateException("rate limited"));

        ToolResult result = dispatcher.dispatch("call-3", "web_search", Map.of("q", "x"), List.of("web_search"));

        assertFalse(result.success());
        assertEquals("rate limited", result.error());
    }

    @Test
    void testLongOutputIsTruncated() {
        when(webSearch.call(anyString())).thenReturn("x".repeat(50));

        ToolResult result = dispatcher.dispatch("call-4", "web_search", Map.of("query", "x"), List.of("web_search"));

        assertEquals("x".repeat(20) + "\n... (truncated)", result.content());
    }

    private static ToolCallback callback(String name) {
        ToolCallback callback = mock(ToolCallback.class);
        when(callback.getToolDefinition()).thenReturn(ToolDefinition.builder()
                .name(name)
                .description(name + " tool")
                .inputSchema("{}")
                .build());
        return callback;
    }
}
