package com.jz.honeypot.pipeline;

/** 流水线中的一步，读写同一个 PipelineState */
public interface PipelineStage {

    String name();

    void apply(PipelineState state);
}
