package com.jz.honeypot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AsyncConfig {

    /** 生成调用专用线程池（调用方带超时等待结果） */
    @Bean(name = "generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor(GenerationProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.getExecutorCoreSize());
        ex.setMaxPoolSize(props.getExecutorMaxSize());
        ex.setQueueCapacity(props.getExecutorQueueCapacity());
        ex.setKeepAliveSeconds(60);
        ex.setThreadNamePrefix("decoy-gen-");
        ex.setAwaitTerminationSeconds(10);
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
