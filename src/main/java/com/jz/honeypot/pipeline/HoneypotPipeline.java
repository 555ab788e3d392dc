package com.jz.honeypot.pipeline;

import com.jz.honeypot.pipeline.stage.DecideStage;
import com.jz.honeypot.pipeline.stage.DetectStage;
import com.jz.honeypot.pipeline.stage.ExtractStage;
import com.jz.honeypot.pipeline.stage.ReplyStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * detect -> extract -> decide -> reply，每条消息都跑完全部阶段。
 * 顺序固定：decide 需要看到 extract 的结果。
 */
@Slf4j
@Component
public class HoneypotPipeline {

    private final List<PipelineStage> stages;

    public HoneypotPipeline(DetectStage detect, ExtractStage extract, DecideStage decide, ReplyStage reply) {
        this.stages = List.of(detect, extract, decide, reply);
    }

    public PipelineState run(PipelineState state) {
        for (PipelineStage stage : stages) {
            stage.apply(state);
            log.debug("session={} stage={} confidence={} scam={} finalize={}", state.getSessionId(),
                    stage.name(), state.getConfidence(), state.isScamDetected(), state.isShouldFinalize());
        }
        return state;
    }

    public List<String> stageNames() {
        return stages.stream().map(PipelineStage::name).toList();
    }
}
