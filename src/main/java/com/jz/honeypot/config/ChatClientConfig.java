package com.jz.honeypot.config;


import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatClientConfig {

    // 无状态：每次调用都由上层传入完整的消息列表
    @Bean
    public ChatClient decoyChatClient(@Qualifier("generationChatModel") ChatModel chatModel) {
        return ChatClient.builder(chatModel).build();
    }
}
