package com.jz.honeypot.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HoneypotReplyDTO {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private String status;
    private String reply;
    private Boolean scamDetected;
    private ExtractedIntelligenceDTO extractedIntelligence;
    private AgentStateDTO agentState;

    public static HoneypotReplyDTO error(String reply) {
        return HoneypotReplyDTO.builder().status(STATUS_ERROR).reply(reply).build();
    }
}
