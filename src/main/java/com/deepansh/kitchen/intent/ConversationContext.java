package com.deepansh.kitchen.intent;

import java.util.List;

/**
 * Per-session conversational memory handed to the intent resolver.
 * Scoped to one session; loaded before a request and saved after it.
 */
public record ConversationContext(String sessionId, List<ConversationTurn> turns) {

    public ConversationContext {
        turns = List.copyOf(turns);
    }

    public static ConversationContext empty(String sessionId) {
        return new ConversationContext(sessionId, List.of());
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }
}
