package com.deepansh.kitchen.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One inbound user query.
 */
public record Query(String text, String sessionId, Instant timestamp, List<Attachment> attachments) {

    public Query {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(sessionId, "sessionId");
        timestamp = timestamp != null ? timestamp : Instant.now();
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
    }

    public static Query of(String text, String sessionId) {
        return new Query(text, sessionId, Instant.now(), List.of());
    }
}
