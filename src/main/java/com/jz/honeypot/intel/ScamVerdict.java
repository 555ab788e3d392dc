package com.jz.honeypot.intel;

/** 单条消息的打分结果 */
public record ScamVerdict(double confidence, boolean scamDetected) {}
