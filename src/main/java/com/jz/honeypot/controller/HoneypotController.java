package com.jz.honeypot.controller;

import com.jz.honeypot.domain.dto.HoneypotReplyDTO;
import com.jz.honeypot.domain.dto.IncomingEvent;
import com.jz.honeypot.service.HoneypotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * 消息接入口。密钥校验在更早的 {@link com.jz.honeypot.auth.ApiKeyAuthFilter} 里完成。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HoneypotController {
    private final HoneypotService honeypotService;

    @PostMapping("/message")
    public HoneypotReplyDTO message(@RequestBody IncomingEvent event) {
        HoneypotReplyDTO reply = honeypotService.handle(event);
        log.debug("session={} status={} scam={}", event.getSessionId(), reply.getStatus(), reply.getScamDetected());
        return reply;
    }
}
