package com.deepansh.kitchen.intent;

import java.time.Instant;

/**
 * One past exchange in a session: what the user asked and a short summary
 * of what was answered.
 */
public record ConversationTurn(String query, String answerSummary, Instant at) {
}
