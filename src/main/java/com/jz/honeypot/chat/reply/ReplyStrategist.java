package com.jz.honeypot.chat.reply;

import com.jz.honeypot.chat.prompt.DecoyPrompts;
import com.jz.honeypot.config.GenerationProperties;
import com.jz.honeypot.pipeline.PipelineState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 为单条消息挑选诱饵回复：
 * - 非诈骗：固定的澄清话术
 * - 诈骗：走生成服务；任何生成失败都回落到固定兜底话术
 * 不抛异常。
 */
@Slf4j
@Component
public class ReplyStrategist {

    private final ReplyGenerator generator;
    private final GenerationProperties props;
    private final Counter fallbackCounter;

    public ReplyStrategist(ReplyGenerator generator, GenerationProperties props, MeterRegistry registry) {
        this.generator = generator;
        this.props = props;
        this.fallbackCounter = Counter.builder("honeypot.reply.fallback.count")
                .description("Replies served from the fixed fallback after a generation failure")
                .register(registry);
    }

    public String buildReply(PipelineState state) {
        if (!state.isScamDetected()) {
            return DecoyReplies.CLARIFICATION;
        }

        String hint = DecoyPrompts.hint(state.getEvidence(), state.getText());
        List<ChatTurn> turns = List.of(
                ChatTurn.system(DecoyPrompts.PERSONA),
                ChatTurn.user(DecoyPrompts.userTurn(state.getText(), hint))
        );

        try {
            String raw = generator.generate(turns, props.getMaxTokens());
            String reply = firstLine(raw, props.getMaxReplyChars());
            if (reply.isEmpty()) {
                throw new GenerationException(GenerationException.Reason.MALFORMED, "blank first line");
            }
            return reply;
        } catch (GenerationException e) {
            log.warn("Decoy generation failed ({}), using fallback. err={}", e.getReason(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Decoy generation failed unexpectedly, using fallback. err={}", e.toString());
        }
        fallbackCounter.increment();
        return DecoyReplies.FALLBACK;
    }

    static String firstLine(String raw, int maxChars) {
        if (raw == null) return "";
        String s = raw.strip();
        int nl = s.indexOf('\n');
        if (nl >= 0) s = s.substring(0, nl);
        s = s.strip();
        // 按码点截断，避免把代理对切成两半
        if (s.codePointCount(0, s.length()) <= maxChars) return s;
        return s.substring(0, s.offsetByCodePoints(0, maxChars));
    }
}
