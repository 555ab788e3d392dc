package com.jz.honeypot.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 结案报告，每个会话只上报一次 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinalizeReportDTO {
    private String sessionId;
    private boolean scamDetected;
    private int totalMessagesExchanged;
    private ExtractedIntelligenceDTO extractedIntelligence;
    private String agentNotes;
}
