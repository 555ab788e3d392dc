package com.jz.honeypot.report;

import com.jz.honeypot.domain.entity.HoneypotSession;

/**
 * 把已结案会话的情报上报给外部收集端。
 * 每个会话只在结案那一刻调用一次，调用时持有会话锁。
 * 实现不得抛异常，也不得重试。
 */
public interface FinalizeReporter {
    ReportOutcome report(HoneypotSession session);
}
