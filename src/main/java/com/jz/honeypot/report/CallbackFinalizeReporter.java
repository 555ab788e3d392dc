package com.jz.honeypot.report;

import com.jz.honeypot.config.ReportProperties;
import com.jz.honeypot.domain.dto.ExtractedIntelligenceDTO;
import com.jz.honeypot.domain.dto.FinalizeReportDTO;
import com.jz.honeypot.domain.entity.HoneypotSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * 把结案报告以 JSON POST 到 {@code honeypot.report.callback-url}。
 * 最多尝试一次；失败以 {@link ReportOutcome#failed(String)} 返回，不抛异常。
 */
@Slf4j
@Component
public class CallbackFinalizeReporter implements FinalizeReporter {

    private final RestTemplate restTemplate;
    private final ReportProperties props;

    public CallbackFinalizeReporter(@Qualifier("reportRestTemplate") RestTemplate restTemplate,
                                    ReportProperties props) {
        this.restTemplate = restTemplate;
        this.props = props;
    }

    @Override
    public ReportOutcome report(HoneypotSession session) {
        if (!props.isEnabled() || props.getCallbackUrl() == null || props.getCallbackUrl().isBlank()) {
            log.info("Finalize report disabled, session={} not delivered", session.getId());
            return ReportOutcome.skipped("Callback disabled.");
        }

        FinalizeReportDTO payload = payloadOf(session, props.getDefaultNote());
        try {
            ResponseEntity<String> resp = restTemplate.postForEntity(props.getCallbackUrl(), payload, String.class);
            if (resp.getStatusCode().isError()) {
                // 仅在自定义了宽松 ErrorHandler 时才会走到这里
                log.warn("Finalize callback rejected session={} status={}", session.getId(), resp.getStatusCode().value());
                return ReportOutcome.failed("Callback failed: " + resp.getStatusCode().value());
            }
            log.info("Finalize report delivered session={} messages={}", session.getId(), payload.getTotalMessagesExchanged());
            return ReportOutcome.delivered();
        } catch (RestClientResponseException e) {
            log.warn("Finalize callback rejected session={} status={}", session.getId(), e.getStatusCode().value());
            return ReportOutcome.failed("Callback failed: " + e.getStatusCode().value());
        } catch (RestClientException e) {
            log.warn("Finalize callback error session={} err={}", session.getId(), e.toString());
            return ReportOutcome.failed("Callback exception.");
        }
    }

    static FinalizeReportDTO payloadOf(HoneypotSession session, String defaultNote) {
        String notes = session.getNotes();
        return FinalizeReportDTO.builder()
                .sessionId(session.getId())
                .scamDetected(true)
                .totalMessagesExchanged(session.getMessageCount())
                .extractedIntelligence(ExtractedIntelligenceDTO.of(session.getEvidence()))
                .agentNotes(notes == null || notes.isBlank() ? defaultNote : notes)
                .build();
    }
}
