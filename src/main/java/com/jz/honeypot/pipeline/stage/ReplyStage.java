package com.jz.honeypot.pipeline.stage;

import com.jz.honeypot.chat.reply.ReplyStrategist;
import com.jz.honeypot.pipeline.PipelineStage;
import com.jz.honeypot.pipeline.PipelineState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReplyStage implements PipelineStage {
    private final ReplyStrategist strategist;

    @Override
    public String name() { return "reply"; }

    @Override
    public void apply(PipelineState state) {
        state.setReply(strategist.buildReply(state));
    }
}
