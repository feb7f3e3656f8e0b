package com.locai.workflow.model;

/**
 * A prior chat turn replayed into the model context; role is {@code user} or {@code assistant}.
 */
public record ConversationTurn(String role, String content) {
}
