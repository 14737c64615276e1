package com.deepansh.kitchen.llm;

public enum ResponseFormat {
    TEXT,
    /** OpenAI-compatible {@code response_format: {"type": "json_object"}} */
    JSON_OBJECT
}
