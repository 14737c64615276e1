package com.deepansh.kitchen.intent;

import java.util.List;

/**
 * Input to the reasoning collaborator: the query text and prior turns.
 */
public record ReasoningRequest(String text, List<ConversationTurn> conversationHistory) {

    public ReasoningRequest {
        conversationHistory = List.copyOf(conversationHistory);
    }
}
