package com.locai.workflow.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Request-scoped context replayed into every model call of a run: the selected preset's prompt
 * and the prior chat turns.
 */
public record ConversationContext(@Nullable String presetPrompt, List<ConversationTurn> history) {

    public ConversationContext {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static ConversationContext empty() {
        return new ConversationContext(null, List.of());
    }
}
