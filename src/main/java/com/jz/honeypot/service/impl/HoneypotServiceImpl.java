package com.jz.honeypot.service.impl;

import com.jz.honeypot.common.InvalidEventException;
import com.jz.honeypot.config.SessionProperties;
import com.jz.honeypot.domain.dto.AgentStateDTO;
import com.jz.honeypot.domain.dto.ChatMessageDTO;
import com.jz.honeypot.domain.dto.ExtractedIntelligenceDTO;
import com.jz.honeypot.domain.dto.HoneypotReplyDTO;
import com.jz.honeypot.domain.dto.IncomingEvent;
import com.jz.honeypot.domain.entity.HoneypotSession;
import com.jz.honeypot.pipeline.HoneypotPipeline;
import com.jz.honeypot.pipeline.PipelineState;
import com.jz.honeypot.report.FinalizeReporter;
import com.jz.honeypot.report.ReportOutcome;
import com.jz.honeypot.service.HoneypotService;
import com.jz.honeypot.session.SessionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

@Slf4j
@Service
public class HoneypotServiceImpl implements HoneypotService {

    static final String FINALIZE_NOTE = "Detected scam intent; extracted artifacts from conversation.";

    private final SessionStore sessionStore;
    private final HoneypotPipeline pipeline;
    private final FinalizeReporter reporter;
    private final SessionProperties sessionProps;

    private final Timer pipelineTimer;
    private final Counter finalizedCounter;
    private final Counter reportFailureCounter;

    public HoneypotServiceImpl(SessionStore sessionStore,
                               HoneypotPipeline pipeline,
                               FinalizeReporter reporter,
                               SessionProperties sessionProps,
                               MeterRegistry registry) {
        this.sessionStore = sessionStore;
        this.pipeline = pipeline;
        this.reporter = reporter;
        this.sessionProps = sessionProps;

        this.pipelineTimer = Timer.builder("honeypot.pipeline.latency")
                .description("Latency of one pipeline run (detect->extract->decide->reply)")
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
        this.finalizedCounter = Counter.builder("honeypot.session.finalized.count")
                .description("Sessions that reached the finalize transition")
                .register(registry);
        this.reportFailureCounter = Counter.builder("honeypot.report.failure.count")
                .description("Finalize reports that could not be delivered")
                .register(registry);
    }

    @Override
    public HoneypotReplyDTO handle(IncomingEvent event) {
        validate(event);
        return sessionStore.withSession(event.getSessionId(), session -> process(session, event));
    }

    // 在会话锁内执行
    private HoneypotReplyDTO process(HoneypotSession session, IncomingEvent event) {
        PipelineState state = PipelineState.seed(session.getId(), event.getMessage(),
                recentHistory(event.getConversationHistory(), sessionProps.getHistoryTurns()),
                session.getEvidence());

        // 流水线全部跑完之前不改动会话
        Timer.Sample sample = Timer.start();
        pipeline.run(state);
        sample.stop(pipelineTimer);

        session.recordMessage(sessionStore.now());
        session.getEvidence().mergeFrom(state.getEvidence());

        if (state.isShouldFinalize() && session.markFinalized()) {
            finalizedCounter.increment();
            session.appendNote(FINALIZE_NOTE);
            log.info("Session finalized id={} messages={} evidence={}",
                    session.getId(), session.getMessageCount(), session.getEvidence());
            deliverReport(session);
        }

        return HoneypotReplyDTO.builder()
                .status(HoneypotReplyDTO.STATUS_SUCCESS)
                .reply(state.getReply())
                .scamDetected(state.isScamDetected())
                .extractedIntelligence(ExtractedIntelligenceDTO.of(session.getEvidence()))
                .agentState(AgentStateDTO.builder()
                        .confidence(round3(state.getConfidence()))
                        .totalMessagesExchanged(session.getMessageCount())
                        .finalized(session.isFinalized())
                        .build())
                .build();
    }

    // 只尝试一次，不重试；无论结果如何结案标记都不回退
    private void deliverReport(HoneypotSession session) {
        ReportOutcome outcome;
        try {
            outcome = reporter.report(session);
        } catch (RuntimeException e) {
            log.error("Finalize reporter threw for session={}", session.getId(), e);
            outcome = ReportOutcome.failed("Callback exception.");
        }
        if (outcome.status() == ReportOutcome.Status.FAILED) {
            reportFailureCounter.increment();
            session.appendNote(outcome.note());
        }
    }

    private static void validate(IncomingEvent event) {
        if (event == null) throw new InvalidEventException("empty body");
        if (event.getSessionId() == null || event.getSessionId().isBlank()) {
            throw new InvalidEventException("sessionId is required");
        }
        if (event.getMessage() == null) throw new InvalidEventException("message is required");
    }

    static List<ChatMessageDTO> recentHistory(List<ChatMessageDTO> history, int turns) {
        if (history == null || history.isEmpty() || turns <= 0) return List.of();
        int from = Math.max(0, history.size() - turns);
        return history.subList(from, history.size()).stream().filter(Objects::nonNull).toList();
    }

    static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
