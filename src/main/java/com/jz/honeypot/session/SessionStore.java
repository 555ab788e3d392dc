package com.jz.honeypot.session;

import com.jz.honeypot.domain.entity.HoneypotSession;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * 内存会话注册表，两级锁：
 * <ul>
 * <li><b>注册表锁</b>：只保护 map（查找、创建、清理），持有时间很短，处理消息时不持有。</li>
 * <li><b>会话锁</b>：每个会话一把，处理一条消息的全过程（初始化、流水线、合并、结案、上报）都持有。
 * 同一 id 的请求按到达顺序排队，不同 id 互不影响。</li>
 * </ul>
 * 除非 {@link SessionSweeper} 调用 {@link #evictIdle(Duration)}，会话常驻内存，注册表会一直增长。
 */
@Slf4j
@Component
public class SessionStore {

    private final ReentrantLock registryLock = new ReentrantLock();
    private final Map<String, SessionEntry> entries = new HashMap<>();
    private final Clock clock;

    public SessionStore(Clock clock, MeterRegistry registry) {
        this.clock = clock;
        Gauge.builder("honeypot.sessions.active", this, SessionStore::size)
                .description("Sessions currently held in memory")
                .register(registry);
    }

    /**
     * 独占会话执行 {@code fn}，首次访问时创建会话。
     * 无论正常返回还是抛异常，会话锁都会释放。
     */
    public <T> T withSession(String sessionId, Function<HoneypotSession, T> fn) {
        Objects.requireNonNull(sessionId, "sessionId");
        SessionEntry entry = checkout(sessionId);
        try {
            entry.lock.lock();
            try {
                return fn.apply(entry.session);
            } finally {
                entry.lock.unlock();
            }
        } finally {
            checkin(entry);
        }
    }

    public Instant now() {
        return clock.instant();
    }

    public int size() {
        registryLock.lock();
        try {
            return entries.size();
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 清理无人使用且最后更新早于 {@code idleTtl} 的会话。
     * 被清理的会话再次到来时从头开始（结案标记也会重置）。
     *
     * @return 清理的会话数
     */
    public int evictIdle(Duration idleTtl) {
        if (idleTtl == null || idleTtl.isZero() || idleTtl.isNegative()) return 0;
        Instant cutoff = clock.instant().minus(idleTtl);
        int removed = 0;
        registryLock.lock();
        try {
            Iterator<SessionEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                SessionEntry e = it.next();
                // users == 0：没有线程持有或等待该会话锁
                if (e.users == 0 && e.session.getUpdatedAt().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            registryLock.unlock();
        }
        if (removed > 0) log.info("Evicted {} idle sessions (ttl={})", removed, idleTtl);
        return removed;
    }

    private SessionEntry checkout(String sessionId) {
        registryLock.lock();
        try {
            SessionEntry e = entries.computeIfAbsent(sessionId, id -> {
                log.info("New honeypot session id={}", id);
                return new SessionEntry(new HoneypotSession(id, clock.instant()));
            });
            e.users++;
            return e;
        } finally {
            registryLock.unlock();
        }
    }

    private void checkin(SessionEntry e) {
        registryLock.lock();
        try {
            e.users--;
        } finally {
            registryLock.unlock();
        }
    }
}
