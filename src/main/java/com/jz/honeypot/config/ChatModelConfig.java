package com.jz.honeypot.config;

import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.model.NoopApiKey;
import org.springframework.ai.model.SimpleApiKey;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class ChatModelConfig {

    @Bean
    public OpenAiApi generationApi(GenerationProperties props) {
        return OpenAiApi.builder()
                .baseUrl(props.getBaseUrl())
                .completionsPath(props.getCompletionsPath())
                .apiKey(props.getApiKey() == null || props.getApiKey().isBlank()
                        ? new NoopApiKey() : new SimpleApiKey(props.getApiKey()))
                .build();
    }

    // 只调用一次：超时由调用方控制，失败直接走兜底回复
    @Bean
    public ChatModel generationChatModel(OpenAiApi generationApi, GenerationProperties props) {
        return OpenAiChatModel.builder()
                .openAiApi(generationApi)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(props.getModel())
                        .temperature(props.getTemperature())
                        .topP(props.getTopP())
                        .maxTokens(props.getMaxTokens())
                        .build())
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
    }
}
