package com.locai.workflow.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A ToolCallbackProvider wrapper that filters the delegate provider's callbacks by enabled tool names.
 * Name matching is case-insensitive and tolerates namespace prefixes such as {@code fs.read_file}.
 * If the enabled set is empty, provides no tools.
 */
public class FilteringToolCallbackProvider implements ToolCallbackProvider {

    private static final Logger log = LoggerFactory.getLogger(FilteringToolCallbackProvider.class);
    private final ToolCallbackProvider delegate;
    private final Set<String> enabledNames;

    public FilteringToolCallbackProvider(ToolCallbackProvider delegate, @Nullable Collection<String> enabledNames) {
        this.delegate = delegate;
        this.enabledNames = enabledNames == null ? Set.of() : enabledNames.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    @Override
    public ToolCallback[] getToolCallbacks() {
        ToolCallback[] callbacks = delegate.getToolCallbacks();
        if (callbacks == null || callbacks.length == 0 || enabledNames.isEmpty()) {
            return new ToolCallback[0];
        }
        ToolCallback[] filtered = Arrays.stream(callbacks)
                .filter(this::isEnabled)
                .toArray(ToolCallback[]::new);
        if (filtered.length == 0 && log.isDebugEnabled()) {
            log.debug("Tool filtering removed all callbacks. enabled={}, available={}",
                    enabledNames, Arrays.stream(callbacks).map(FilteringToolCallbackProvider::toolName).toList());
        }
        return filtered;
    }

    private boolean isEnabled(ToolCallback callback) {
        String name = toolName(callback).toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            return false;
        }
        return enabledNames.contains(name) || enabledNames.contains(stripPrefix(name));
    }

    /**
     * Name under which a callback is advertised, empty when it has none.
     */
    public static String toolName(@Nullable ToolCallback callback) {
        if (callback == null) {
            return "";
        }
        ToolDefinition definition = callback.getToolDefinition();
        if (definition == null || definition.name() == null) {
            return "";
        }
        return definition.name().trim();
    }

    /**
     * Finds the available tool a requested name refers to, matching the full name or the name without its namespace.
     */
    public static Optional<String> resolve(@Nullable String requested, Collection<String> available) {
        if (requested == null || requested.isBlank()) {
            return Optional.empty();
        }
        String wanted = requested.trim();
        return available.stream()
                .filter(candidate -> candidate.equalsIgnoreCase(wanted) || stripPrefix(candidate).equalsIgnoreCase(wanted))
                .findFirst();
    }

    static String stripPrefix(String name) {
        int idx = Math.max(name.lastIndexOf('.'), Math.max(name.lastIndexOf('/'), name.lastIndexOf(':')));
        if (idx < 0 || idx + 1 >= name.length()) {
            return name;
        }
        return name.substring(idx + 1);
    }
}
