package com.jz.honeypot.common;

/** 请求体结构不可用（缺 sessionId 或 message） */
public class InvalidEventException extends RuntimeException {
    public InvalidEventException(String message) {
        super(message);
    }
}
