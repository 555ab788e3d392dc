package com.jz.honeypot.intel;

import com.jz.honeypot.domain.entity.Evidence;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从单条消息里抽取链接、收款账号、手机号、银行账号和可疑关键词。纯函数，不抛异常。
 * <p>
 * 各类别之间不去重：手机号会同时出现在 phoneNumbers 和 accountNumbers 里。
 */
@Component
public class ArtifactExtractor {

    public Evidence extract(String text) {
        Evidence out = new Evidence();
        if (text == null || text.isEmpty()) return out;

        forEachMatch(ArtifactPatterns.URL, text, m -> out.addLink(trimLink(m)));
        forEachMatch(ArtifactPatterns.SHORT_LINK, text, m -> out.addLink(trimLink(m)));
        forEachMatch(ArtifactPatterns.PAYMENT_HANDLE, text, out::addPaymentHandle);
        forEachMatch(ArtifactPatterns.PHONE, text, m -> out.addPhoneNumber(m.strip()));
        forEachMatch(ArtifactPatterns.ACCOUNT_NUMBER, text, out::addAccountNumber);

        String lower = text.toLowerCase(Locale.ROOT);
        for (String kw : ArtifactPatterns.SUSPICIOUS_KEYWORDS) {
            if (lower.contains(kw)) out.addKeyword(kw);
        }
        return out;
    }

    static String trimLink(String raw) {
        String s = raw.strip();
        int end = s.length();
        while (end > 0 && ArtifactPatterns.LINK_TRAILING_PUNCTUATION.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(0, end);
    }

    private static void forEachMatch(Pattern p, String text, Consumer<String> sink) {
        Matcher m = p.matcher(text);
        while (m.find()) sink.accept(m.group());
    }
}
