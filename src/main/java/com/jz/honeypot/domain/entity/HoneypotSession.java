package com.jz.honeypot.domain.entity;

import lombok.Getter;

import java.time.Instant;

/**
 * 与疑似诈骗方的一次会话，以调用方传入的 sessionId 为键。
 * 存放在 {@link com.jz.honeypot.session.SessionStore} 中；下面所有修改方法都必须在持有会话锁时调用。
 */
@Getter
public class HoneypotSession {
    private final String id;
    private final Instant createdAt;
    private Instant updatedAt;
    private int messageCount;
    private boolean finalized;
    private String notes = "";
    private final Evidence evidence = new Evidence();

    public HoneypotSession(String id, Instant createdAt) {
        this.id = id;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public void recordMessage(Instant at) {
        this.messageCount++;
        this.updatedAt = at;
    }

    /**
     * 置结案标记
     *
     * @return 只有完成 false -> true 切换的那次调用返回 true
     */
    public boolean markFinalized() {
        if (finalized) return false;
        finalized = true;
        return true;
    }

    public void appendNote(String note) {
        if (note == null || note.isBlank()) return;
        notes = notes.isEmpty() ? note.trim() : notes + " " + note.trim();
    }
}
