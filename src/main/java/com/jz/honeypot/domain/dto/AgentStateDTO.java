package com.jz.honeypot.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentStateDTO {
    /** 保留 3 位小数 */
    private double confidence;
    private int totalMessagesExchanged;
    private boolean finalized;
}
