package com.jz.honeypot.service;

import com.jz.honeypot.domain.dto.HoneypotReplyDTO;
import com.jz.honeypot.domain.dto.IncomingEvent;

public interface HoneypotService {

    /**
     * 在会话锁内完整处理一条消息：流水线、证据合并、结案以及（仅一次的）上报
     */
    HoneypotReplyDTO handle(IncomingEvent event);
}
