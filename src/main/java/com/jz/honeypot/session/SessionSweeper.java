package com.jz.honeypot.session;

import com.jz.honeypot.config.SessionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** 定时清理空闲会话；{@code honeypot.session.idle-ttl} 不为正数时什么都不做 */
@Component
@RequiredArgsConstructor
public class SessionSweeper {
    private final SessionStore store;
    private final SessionProperties props;

    @Scheduled(fixedDelayString = "${honeypot.session.sweep-interval:PT5M}",
            initialDelayString = "${honeypot.session.sweep-interval:PT5M}")
    public void sweep() {
        store.evictIdle(props.getIdleTtl());
    }
}
