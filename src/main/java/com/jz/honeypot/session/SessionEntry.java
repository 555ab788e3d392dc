package com.jz.honeypot.session;

import com.jz.honeypot.domain.entity.HoneypotSession;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 注册表中的一项：会话本身 + 串行处理它的锁。
 * {@code users} 记录 checkout 与 checkin 之间的调用方数量，只在注册表锁内读写。
 */
final class SessionEntry {
    final HoneypotSession session;
    // 公平锁：同一会话的请求按到达顺序处理
    final ReentrantLock lock = new ReentrantLock(true);
    int users;

    SessionEntry(HoneypotSession session) {
        this.session = session;
    }
}
