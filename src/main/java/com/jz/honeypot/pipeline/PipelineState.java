package com.jz.honeypot.pipeline;

import com.jz.honeypot.domain.dto.ChatMessageDTO;
import com.jz.honeypot.domain.entity.Evidence;
import lombok.Data;

import java.util.List;

/**
 * 单条消息在流水线各阶段之间传递的可变状态。
 * 不跨请求共享；evidence 是会话证据的副本，各阶段可以随意写。
 */
@Data
public class PipelineState {

    // --- 输入 ---
    private final String sessionId;
    private final String text;
    private final String sender;
    private final List<ChatMessageDTO> history;

    // --- 证据：会话副本 + 本条消息的抽取结果 ---
    private final Evidence evidence;

    // --- 各阶段输出 ---
    private double confidence;
    private boolean scamDetected;
    private boolean shouldFinalize;
    private String reply;

    /**
     * 以会话证据的副本初始化，不与会话共享引用
     */
    public static PipelineState seed(String sessionId, ChatMessageDTO message,
                                     List<ChatMessageDTO> history, Evidence sessionEvidence) {
        return new PipelineState(
                sessionId,
                message.getText() == null ? "" : message.getText(),
                message.getSender(),
                history == null ? List.of() : List.copyOf(history),
                sessionEvidence == null ? new Evidence() : sessionEvidence.copy());
    }
}
