package com.deepansh.kitchen.llm;

import java.util.List;

public interface LlmClient {

    /**
     * Send a conversation to the LLM and return its reply.
     *
     * @param messages system + user (+ optional history) messages
     * @param format   TEXT, or JSON_OBJECT to force a single JSON object reply
     * @throws com.deepansh.kitchen.exception.LlmException on provider or transport failure
     */
    LlmResponse chat(List<Message> messages, ResponseFormat format);
}
