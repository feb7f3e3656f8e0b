package com.locai.workflow.tools;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps parameter names that local models commonly get wrong onto the canonical ones.
 * An alias is only rewritten when the canonical key is absent; unknown tools pass through.
 */
@Component
public class ToolArgumentNormalizer {

    private static final Map<String, String> FILE_PATH_ALIASES = orderedMap(
            "title", "path",
            "filename", "path",
            "file", "path",
            "name", "path",
            "file_path", "path",
            "filepath", "path");

    private static final Map<String, String> QUERY_ALIASES = orderedMap(
            "q", "query",
            "search", "query",
            "term", "query");

    private static final Map<String, Map<String, String>> ALIASES = Map.of(
            "write_file", merge(FILE_PATH_ALIASES, orderedMap(
                    "text", "content",
                    "body", "content",
                    "data", "content")),
            "read_file", FILE_PATH_ALIASES,
            "edit_file", orderedMap(
                    "filename", "path",
                    "file", "path",
                    "file_path", "path",
                    "search", "old_text",
                    "find", "old_text",
                    "replace", "new_text"),
            "create_note", orderedMap(
                    "name", "title",
                    "heading", "title",
                    "text", "content",
                    "body", "content"),
            "run_command", orderedMap(
                    "cmd", "command",
                    "exec", "command",
                    "shell", "command"),
            "web_search", QUERY_ALIASES,
            "search_documents", QUERY_ALIASES);

    /**
     * Returns a normalized copy; the input map is never modified.
     */
    public Map<String, Object> normalize(String toolName, Map<String, Object> arguments) {
        String baseName = FilteringToolCallbackProvider.stripPrefix(toolName).toLowerCase(Locale.ROOT);
        Map<String, String> aliases = ALIASES.get(baseName);
        if (aliases == null || arguments == null) {
            return arguments == null ? Map.of() : arguments;
        }
        Map<String, Object> normalized = new LinkedHashMap<>(arguments);
        aliases.forEach((alias, canonical) -> {
            if (normalized.containsKey(alias) && !normalized.containsKey(canonical)) {
                normalized.put(canonical, normalized.remove(alias));
            }
        });
        return normalized;
    }

    private static Map<String, String> orderedMap(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }

    private static Map<String, String> merge(Map<String, String> first, Map<String, String> second) {
        Map<String, String> map = new LinkedHashMap<>(first);
        map.putAll(second);
        return map;
    }
}
