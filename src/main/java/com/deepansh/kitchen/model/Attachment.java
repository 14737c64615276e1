package com.deepansh.kitchen.model;

/**
 * Reference to a file the user sent along with the query (e.g. a grocery bill photo).
 * The orchestrator only carries it; reading it is up to the agents.
 */
public record Attachment(String name, String contentType, String uri) {
}
