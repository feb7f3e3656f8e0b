package com.locai.workflow.tools;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolArgumentNormalizerTest {

    private final ToolArgumentNormalizer normalizer = new ToolArgumentNormalizer();

    @Test
    void testAliasesAreRenamed() {
        Map<String, Object> normalized = normalizer.normalize("write_file", Map.of("filename", "a.txt", "body", "x"));

        assertEquals(Map.of("path", "a.txt", "content", "x"), normalized);
    }

    @Test
    void testCanonicalKeyWins() {
        Map<String, Object> normalized = normalizer.normalize("read_file", Map.of("path", "a.txt", "file", "b.txt"));

        assertEquals("a.txt", normalized.get("path"));
        assertEquals("b.txt", normalized.get("file"));
    }

    @Test
    void testPrefixedToolNameUsesSameAliases() {
        Map<String, Object> normalized = normalizer.normalize("shell.run_command", Map.of("cmd", "ls"));

        assertEquals(Map.of("command", "ls"), normalized);
    }

    @Test
    void testToolNameCaseIsIgnored() {
        Map<String, Object> normalized = normalizer.normalize("FS.Write_File", Map.of("filename", "a.txt"));

        assertEquals(Map.of("path", "a.txt"), normalized);
    }

    @Test
    void testUnknownToolPassesThrough() {
        Map<String, Object> arguments = Map.of("q", "x");

        assertSame(arguments, normalizer.normalize("calculator", arguments));
        assertEquals(Map.of(), normalizer.normalize("calculator", null));
    }
}
