package com.locai.workflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Locale;

public enum NextAction {
    CONTINUE,
    ADJUST_PLAN,
    COMPLETE,
    ABORT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NextAction fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public static @Nullable NextAction parse(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace('-', '_');
        for (NextAction candidate : values()) {
            if (candidate.wireName().equalsIgnoreCase(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
