package com.jz.honeypot.pipeline.stage;

import com.jz.honeypot.intel.ScamScorer;
import com.jz.honeypot.intel.ScamVerdict;
import com.jz.honeypot.pipeline.PipelineStage;
import com.jz.honeypot.pipeline.PipelineState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DetectStage implements PipelineStage {
    private final ScamScorer scorer;

    @Override
    public String name() { return "detect"; }

    @Override
    public void apply(PipelineState state) {
        ScamVerdict v = scorer.detect(state.getText());
        state.setConfidence(v.confidence());
        state.setScamDetected(v.scamDetected());
    }
}
