package com.deepansh.kitchen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResponseSection {

    private AgentId agentId;
    private SectionStatus status;
    private String content;
}
