package com.locai.workflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private static final Pattern CODE_FENCE = Pattern.compile("```[a-zA-Z]*\\s*");

    private final ObjectMapper objectMapper;

    /**
     * Parses the JSON object embedded in a model response. Markdown fences and surrounding prose are ignored.
     *
     * @return the parsed value, or {@code null} when the response holds no parseable object
     */
    public <T> @Nullable T parseJsonResponse(String label, @Nullable String raw, Class<T> type) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Empty response for {}. Unable to parse JSON.", label);
            return null;
        }
        String json = extractJsonObject(raw);
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception ex) {
            log.warn("Failed to parse {} response as JSON. Snippet: {}", label, truncate(raw, 240));
            return null;
        }
    }

    String extractJsonObject(String raw) {
        String trimmed = CODE_FENCE.matcher(raw).replaceAll("").replace("```", "").trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return trimmed;
        }
        int firstBrace = trimmed.indexOf('{');
        int lastBrace = trimmed.lastIndexOf('}');
        if (firstBrace >= 0 && lastBrace > firstBrace) {
            return trimmed.substring(firstBrace, lastBrace + 1);
        }
        return trimmed;
    }

    public static String truncate(@Nullable String value, int maxLength) {
        if (value == null) {
            return "";
        }
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), ex);
        }
    }

    public <T> @Nullable T fromJson(@Nullable String json, Class<T> type) {
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to read stored {}: {}", type.getSimpleName(), ex.getOriginalMessage());
            return null;
        }
    }
}
