package com.jz.honeypot.chat.reply;

/** 交给生成服务的一条 role/content */
public record ChatTurn(Role role, String content) {

    public enum Role { SYSTEM, USER, ASSISTANT }

    public static ChatTurn system(String content) { return new ChatTurn(Role.SYSTEM, content); }
    public static ChatTurn user(String content)   { return new ChatTurn(Role.USER, content); }
}
