package com.jz.honeypot.intel;

import com.jz.honeypot.config.SessionProperties;
import com.jz.honeypot.domain.entity.Evidence;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 判断目前收集到的证据是否足以结案。
 * 关键词不算证据类别。
 */
@Component
@RequiredArgsConstructor
public class FinalizePolicy {

    private final SessionProperties props;

    /**
     * @param cumulative          会话累计证据（含本条消息的抽取结果）
     * @param messageScamDetected 仅本条消息的诈骗判定
     */
    public boolean shouldFinalize(Evidence cumulative, boolean messageScamDetected) {
        if (!messageScamDetected || cumulative == null) return false;
        return cumulative.artifactCategoryCount() >= props.getFinalizeMinArtifacts();
    }
}
