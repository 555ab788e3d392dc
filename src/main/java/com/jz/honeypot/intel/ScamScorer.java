package com.jz.honeypot.intel;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * 基于关键词和正则的累加式打分，只看单条消息文本。
 * 相同输入永远得到相同分数。
 */
@Component
public class ScamScorer {

    public static final double DETECTION_THRESHOLD = 0.35;

    static final double STRONG_PHRASE_WEIGHT = 0.18;
    static final double KEYWORD_WEIGHT = 0.05;
    static final double LINK_WEIGHT = 0.25;
    static final double PAYMENT_HANDLE_WEIGHT = 0.25;
    static final double PHONE_WEIGHT = 0.10;

    public double score(String text) {
        if (text == null || text.isBlank()) return 0.0;
        String t = text.toLowerCase(Locale.ROOT);
        double score = 0.0;

        // 同时出现在两个词表里的词两边都计分
        score += STRONG_PHRASE_WEIGHT * countContained(t, ArtifactPatterns.STRONG_PHRASES);
        score += KEYWORD_WEIGHT * countContained(t, ArtifactPatterns.SUSPICIOUS_KEYWORDS);

        if (ArtifactPatterns.URL.matcher(text).find() || ArtifactPatterns.SHORT_LINK.matcher(text).find()) {
            score += LINK_WEIGHT;
        }
        if (ArtifactPatterns.PAYMENT_HANDLE.matcher(text).find()) score += PAYMENT_HANDLE_WEIGHT;
        if (ArtifactPatterns.PHONE.matcher(text).find()) score += PHONE_WEIGHT;

        return Math.min(score, 1.0);
    }

    public ScamVerdict detect(String text) {
        double c = score(text);
        return new ScamVerdict(c, c >= DETECTION_THRESHOLD);
    }

    private static int countContained(String lower, List<String> terms) {
        int n = 0;
        for (String k : terms) if (lower.contains(k)) n++;
        return n;
    }
}
