package com.jz.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "honeypot.session")
public class SessionProperties {

    /** 交给流水线的最近历史条数 */
    private int historyTurns = 6;

    /** 结案所需的最少非空证据类别数（链接/收款账号/手机号/银行账号） */
    private int finalizeMinArtifacts = 3;

    /** 空闲超过该时长的会话会被清理；0 或负数表示常驻内存 */
    private Duration idleTtl = Duration.ZERO;

    private Duration sweepInterval = Duration.ofMinutes(5);
}
