package com.jz.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 回复生成服务配置（任意 OpenAI 兼容的 chat completions 接口）
 */
@Data
@ConfigurationProperties(prefix = "honeypot.generation")
public class GenerationProperties {
    private String baseUrl = "https://router.huggingface.co";
    private String completionsPath = "/v1/chat/completions";
    private String apiKey = "";
    private String model = "meta-llama/Meta-Llama-3.1-8B-Instruct";

    /** 单次生成调用的硬超时，由调用方强制 */
    private Duration timeout = Duration.ofSeconds(4);

    private int maxTokens = 1000;
    private double temperature = 0.7;
    private double topP = 0.9;

    /** 回复只取第一行，且最多这么多个字符 */
    private int maxReplyChars = 500;

    private int executorCoreSize = 4;
    private int executorMaxSize = 16;
    private int executorQueueCapacity = 200;
}
