package com.jz.honeypot.chat.reply;

import java.util.List;

/** 诱饵回复的文本生成能力 */
public interface ReplyGenerator {

    /**
     * @param turns       按顺序的消息，第一条是 system 人设
     * @param tokenBudget 生成 token 上限
     * @return 生成文本，不会为空
     * @throws GenerationException 超时、服务异常或输出不可用
     */
    String generate(List<ChatTurn> turns, int tokenBudget) throws GenerationException;
}
