package com.jz.honeypot.chat.reply;

import lombok.Getter;

/** 外部生成服务调用失败 */
@Getter
public class GenerationException extends Exception {

    public enum Reason { TIMEOUT, SERVICE_ERROR, MALFORMED }

    private final Reason reason;

    public GenerationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GenerationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
