package com.locai.workflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Locale;

public enum Assessment {
    SUCCESS,
    PARTIAL,
    FAILURE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Assessment fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Lenient lookup used for model output; unknown values yield {@code null}.
     */
    public static @Nullable Assessment parse(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (Assessment candidate : values()) {
            if (candidate.wireName().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
