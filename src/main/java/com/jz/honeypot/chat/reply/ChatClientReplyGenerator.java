package com.jz.honeypot.chat.reply;

import com.jz.honeypot.config.GenerationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 Spring AI {@link ChatClient} 的 {@link ReplyGenerator}。
 * 阻塞调用放到 generationExecutor 上执行，超过配置的超时就放弃。
 */
@Slf4j
@Component
public class ChatClientReplyGenerator implements ReplyGenerator {

    private final ChatClient chatClient;
    private final AsyncTaskExecutor executor;
    private final GenerationProperties props;

    public ChatClientReplyGenerator(@Qualifier("decoyChatClient") ChatClient chatClient,
                                    @Qualifier("generationExecutor") AsyncTaskExecutor executor,
                                    GenerationProperties props) {
        this.chatClient = chatClient;
        this.executor = executor;
        this.props = props;
    }

    @Override
    public String generate(List<ChatTurn> turns, int tokenBudget) throws GenerationException {
        List<Message> messages = turns.stream().map(ChatClientReplyGenerator::toMessage).toList();
        ChatOptions options = ChatOptions.builder().maxTokens(tokenBudget).build();

        Future<String> call = executor.submit(() -> chatClient.prompt()
                .messages(messages)
                .options(options)
                .call()
                .content());

        String out;
        long timeoutMs = props.getTimeout().toMillis();
        try {
            out = call.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new GenerationException(GenerationException.Reason.TIMEOUT,
                    "generation exceeded " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new GenerationException(GenerationException.Reason.SERVICE_ERROR,
                    "generation failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new GenerationException(GenerationException.Reason.SERVICE_ERROR, "interrupted", e);
        }

        if (out == null || out.isBlank()) {
            throw new GenerationException(GenerationException.Reason.MALFORMED, "empty generation");
        }
        return out.strip();
    }

    private static Message toMessage(ChatTurn t) {
        return switch (t.role()) {
            case SYSTEM -> new SystemMessage(t.content());
            case USER -> new UserMessage(t.content());
            case ASSISTANT -> new AssistantMessage(t.content());
        };
    }
}
