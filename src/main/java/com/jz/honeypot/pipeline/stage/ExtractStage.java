package com.jz.honeypot.pipeline.stage;

import com.jz.honeypot.intel.ArtifactExtractor;
import com.jz.honeypot.pipeline.PipelineStage;
import com.jz.honeypot.pipeline.PipelineState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 不论是否判为诈骗都会抽取，会话证据持续累积 */
@Component
@RequiredArgsConstructor
public class ExtractStage implements PipelineStage {
    private final ArtifactExtractor extractor;

    @Override
    public String name() { return "extract"; }

    @Override
    public void apply(PipelineState state) {
        state.getEvidence().mergeFrom(extractor.extract(state.getText()));
    }
}
