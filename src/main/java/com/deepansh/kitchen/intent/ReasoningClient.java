package com.deepansh.kitchen.intent;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * External reasoning collaborator that proposes agents and entities for a query.
 *
 * The reply is returned as a raw JSON tree on purpose: it is untrusted and
 * {@link IntentResolver} validates it field by field. Expected shape:
 * {@code {"agents": [string], "entities": {string: string}, "confidence": number?, "signals": [string]?}}
 */
public interface ReasoningClient {

    /**
     * @throws com.deepansh.kitchen.exception.LlmException when the collaborator
     *         cannot be reached or does not reply with a JSON object
     */
    JsonNode analyze(ReasoningRequest request);
}
