package com.locai.workflow.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locai.workflow.llm.ModelToolCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers tool calls that a model wrote into plain text instead of returning them as structured calls.
 * Strategies, in order:
 * <ol>
 *     <li>a JSON object with {@code name} and {@code arguments} or {@code parameters}</li>
 *     <li>a JSON object keyed by a tool name, {@code {"write_file": {...}}}</li>
 *     <li>call syntax {@code write_file(path="a.txt", content='x')}, only if no JSON strategy matched</li>
 * </ol>
 * Only known tool names are recognised. Returned calls carry no id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TextToolCallParser {

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARGUMENT_PAIR = Pattern.compile(
            "(\\w+)\\s*[=:]\\s*(?:\"((?:[^\"\\\\]|\\\\.)*)\"|'((?:[^'\\\\]|\\\\.)*)'|([^\\s,]+))");

    private final ObjectMapper objectMapper;

    public List<ModelToolCall> parse(@Nullable String text, Collection<String> knownTools) {
        if (!StringUtils.hasText(text) || knownTools == null || knownTools.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<ModelToolCall> calls = new ArrayList<>();
        for (Map<String, Object> candidate : extractJsonObjects(text)) {
            ModelToolCall call = fromNameAndArguments(candidate, knownTools);
            if (call == null) {
                call = fromToolKey(candidate, knownTools);
            }
            addUnique(call, seen, calls);
        }
        if (calls.isEmpty()) {
            for (ModelToolCall call : fromCallSyntax(text, knownTools)) {
                addUnique(call, seen, calls);
            }
        }
        if (!calls.isEmpty()) {
            log.debug("Recovered {} tool call(s) from text output", calls.size());
        }
        return calls;
    }

    private void addUnique(@Nullable ModelToolCall call, Set<String> seen, List<ModelToolCall> calls) {
        if (call != null && seen.add(call.name() + call.arguments())) {
            calls.add(call);
        }
    }

    private List<Map<String, Object>> extractJsonObjects(String text) {
        String stripped = CODE_FENCE.matcher(text).replaceAll("").replace("```", "");
        List<Map<String, Object>> objects = new ArrayList<>();
        int depth = 0;
        int start = -1;
        for (int i = 0; i < stripped.length(); i++) {
            char c = stripped.charAt(i);
            if (c == '{') {
                if (depth == 0) {
                    start = i;
                }
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
                if (depth == 0 && start >= 0) {
                    Map<String, Object> parsed = tryParse(stripped.substring(start, i + 1));
                    if (parsed != null) {
                        objects.add(parsed);
                    }
                    start = -1;
                }
            }
        }
        return objects;
    }

    private @Nullable Map<String, Object> tryParse(String candidate) {
        try {
            return objectMapper.readValue(candidate, OBJECT_TYPE);
        } catch (Exception ex) {
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    private @Nullable ModelToolCall fromNameAndArguments(Map<String, Object> candidate, Collection<String> knownTools) {
        if (!(candidate.get("name") instanceof String name) || !knownTools.contains(name)) {
            return null;
        }
        Object args = candidate.containsKey("arguments") ? candidate.get("arguments") : candidate.get("parameters");
        if (args == null) {
            return new ModelToolCall(null, name, Map.of());
        }
        if (args instanceof Map<?, ?> map) {
            return new ModelToolCall(null, name, new LinkedHashMap<>((Map<String, Object>) map));
        }
        if (args instanceof String json) {
            Map<String, Object> parsed = tryParse(json);
            return parsed == null ? null : new ModelToolCall(null, name, parsed);
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private @Nullable ModelToolCall fromToolKey(Map<String, Object> candidate, Collection<String> knownTools) {
        for (Map.Entry<String, Object> entry : candidate.entrySet()) {
            if (knownTools.contains(entry.getKey()) && entry.getValue() instanceof Map<?, ?> map) {
                return new ModelToolCall(null, entry.getKey(), new LinkedHashMap<>((Map<String, Object>) map));
            }
        }
        return null;
    }

    private List<ModelToolCall> fromCallSyntax(String text, Collection<String> knownTools) {
        List<ModelToolCall> calls = new ArrayList<>();
        for (String tool : knownTools) {
            Matcher invocation = Pattern.compile(Pattern.quote(tool) + "\\s*\\(([^)]*)\\)").matcher(text);
            while (invocation.find()) {
                String rawArgs = invocation.group(1).trim();
                if (rawArgs.isEmpty()) {
                    continue;
                }
                Map<String, Object> args = new LinkedHashMap<>();
                Matcher pair = ARGUMENT_PAIR.matcher(rawArgs);
                while (pair.find()) {
                    String value = pair.group(2) != null ? pair.group(2)
                            : pair.group(3) != null ? pair.group(3) : pair.group(4);
                    args.put(pair.group(1), value);
                }
                if (!args.isEmpty()) {
                    calls.add(new ModelToolCall(null, tool, args));
                }
            }
        }
        return calls;
    }
}
