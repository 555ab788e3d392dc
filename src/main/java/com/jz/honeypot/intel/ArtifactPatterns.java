package com.jz.honeypot.intel;

import java.util.List;
import java.util.regex.Pattern;

/**
 * {@link ArtifactExtractor} 与 {@link ScamScorer} 共用的正则和词表
 */
public final class ArtifactPatterns {
    private ArtifactPatterns() {}

    // 下列 \w、\d、\b 均按 Unicode 语义匹配：天城文字母也算单词字符

    // --- 链接 ---
    public static final Pattern URL = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);
    public static final Pattern SHORT_LINK = Pattern.compile(
            "\\b(?:bit\\.ly|tinyurl\\.com|t\\.co|goo\\.gl|cutt\\.ly|rb\\.gy)/[A-Za-z0-9_-]+\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);

    // --- 收款账号 local@psp，前后不能紧贴单词字符/点/横线 ---
    // name@gmail 这种单段邮箱也会命中，可接受
    public static final Pattern PAYMENT_HANDLE = Pattern.compile(
            "(?<![\\w.-])[a-zA-Z0-9._-]{2,}@[a-zA-Z0-9]{2,}(?![\\w.-])",
            Pattern.UNICODE_CHARACTER_CLASS);

    // --- 印度手机号，可带 +91 ---
    public static final Pattern PHONE = Pattern.compile("\\b(?:\\+91[-\\s]?)?[6-9]\\d{9}\\b",
            Pattern.UNICODE_CHARACTER_CLASS);

    // 与 PHONE 有重叠：10 位手机号也会记为银行账号
    public static final Pattern ACCOUNT_NUMBER = Pattern.compile("\\b\\d{9,18}\\b", Pattern.UNICODE_CHARACTER_CLASS);

    /** 链接末尾需要去掉的标点 */
    public static final String LINK_TRAILING_PUNCTUATION = ").,;";

    /** 可疑词表，按小写子串匹配 */
    public static final List<String> SUSPICIOUS_KEYWORDS = List.of(
            "urgent", "verify", "account blocked", "blocked today", "suspended", "freeze",
            "kyc", "otp", "pin", "cvv", "click", "link", "refund", "cashback",
            "upi", "bank account", "share details", "immediately"
    );

    /** 高权重短语，与 SUSPICIOUS_KEYWORDS 有重叠 */
    public static final List<String> STRONG_PHRASES = List.of(
            "otp", "cvv", "pin", "verify immediately", "blocked today",
            "account will be blocked", "share your upi", "click the link",
            "refund", "cashback", "kyc update", "suspended"
    );
}
