package com.jz.honeypot.chat.reply;


public final class DecoyReplies {
    private DecoyReplies(){}

    /** 不像诈骗：先问对方是谁，不做任何承诺 */
    public static final String CLARIFICATION =
            "Sorry—who is this and which bank/service is this about? I didn’t request anything.";

    /** 生成失败或没有可用输出时的兜底 */
    public static final String FALLBACK =
            "I’m confused—can you resend the link and tell me the exact steps? My app isn’t opening properly.";
}
