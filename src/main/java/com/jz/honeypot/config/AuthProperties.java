package com.jz.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "honeypot.auth")
public class AuthProperties {
    /** 携带共享密钥的请求头 */
    private String header = "x-api-key";

    /** 期望的密钥值 */
    private String apiKey = "CHANGE_ME";
}
