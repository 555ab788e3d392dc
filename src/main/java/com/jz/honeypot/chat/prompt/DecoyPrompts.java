package com.jz.honeypot.chat.prompt;

import com.jz.honeypot.domain.entity.Evidence;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class DecoyPrompts {
    private DecoyPrompts() {}

    public static final String PERSONA = """
You are a normal person in India replying over SMS/WhatsApp.
You are anxious and slightly confused, willing to cooperate.
Goal: ask questions that make the other person reveal details (UPI ID, phone number, link, bank account, steps).
Never share OTP, PIN, CVV, passwords or any real personal info.
Keep replies short (1-2 sentences), natural, non-robotic.
""";

    static final String HINT_LINK = "They already sent a link; ask to resend / domain name.";
    static final String HINT_HANDLE = "Try to get their UPI ID / receiver name shown on screen.";
    static final String HINT_OTP = "Say OTP not received; ask steps/link instead.";
    static final String HINT_GENERIC = "Ask which bank, exact steps, and link/UPI shown.";

    /**
     * 根据对方已经暴露的信息，给下一句回复的引导提示
     *
     * @param evidence 累计证据（含最新一条）
     * @param latest   最新一条消息文本
     */
    public static String hint(Evidence evidence, String latest) {
        String lower = latest == null ? "" : latest.toLowerCase(Locale.ROOT);
        List<String> parts = new ArrayList<>(3);
        if (!evidence.getLinks().isEmpty()) parts.add(HINT_LINK);
        if (!evidence.getPaymentHandles().isEmpty() || lower.contains("upi")) parts.add(HINT_HANDLE);
        if (lower.contains("otp")) parts.add(HINT_OTP);
        return parts.isEmpty() ? HINT_GENERIC : String.join(" ", parts);
    }

    public static String userTurn(String latest, String hint) {
        return "Latest scammer message: " + latest + "\n\nGuidance: " + hint;
    }
}
