package com.deepansh.kitchen.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class QueryRequest {

    @NotBlank(message = "text must not be blank")
    private String text;

    /**
     * Optional. If provided, the conversation context of this session is used.
     * If null, a new session is created.
     */
    private String sessionId;

    @Valid
    private List<AttachmentRef> attachments = new ArrayList<>();

    @Data
    public static class AttachmentRef {
        @NotBlank
        private String name;
        private String contentType;
        private String uri;
    }
}
