package com.jz.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "honeypot.report")
public class ReportProperties {
    private boolean enabled = true;

    /** 接收结案报告的回调地址（每个会话只发一次） */
    private String callbackUrl = "https://hackathon.guvi.in/api/updateHoneyPotFinalResult";

    private Duration connectTimeout = Duration.ofSeconds(2);
    private Duration timeout = Duration.ofSeconds(5);

    /** 会话备注为空时使用的默认备注 */
    private String defaultNote = "Scammer used urgency + verification tactics; extracted artifacts.";
}
