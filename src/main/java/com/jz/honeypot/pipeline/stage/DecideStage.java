package com.jz.honeypot.pipeline.stage;

import com.jz.honeypot.intel.FinalizePolicy;
import com.jz.honeypot.pipeline.PipelineStage;
import com.jz.honeypot.pipeline.PipelineState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DecideStage implements PipelineStage {
    private final FinalizePolicy policy;

    @Override
    public String name() { return "decide"; }

    @Override
    public void apply(PipelineState state) {
        state.setShouldFinalize(policy.shouldFinalize(state.getEvidence(), state.isScamDetected()));
    }
}
