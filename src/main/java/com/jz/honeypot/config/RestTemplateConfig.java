package com.jz.honeypot.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RestTemplateConfig {

    /** 结案回调专用客户端，连接/读取均有超时 */
    @Bean(name = "reportRestTemplate")
    public RestTemplate reportRestTemplate(RestTemplateBuilder builder, ReportProperties props) {
        return builder
                .connectTimeout(props.getConnectTimeout())
                .readTimeout(props.getTimeout())
                .build();
    }
}
