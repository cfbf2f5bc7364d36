package com.netflowradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Dedicated single thread for the chain log subscriber so log processing stays strictly sequential and
 * never competes with request handling.
 */
@Configuration
public class AsyncConfig {

    public static final String SUBSCRIBER_EXECUTOR = "subscriber-executor";

    @Bean(name = SUBSCRIBER_EXECUTOR)
    public Executor subscriberExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(1);
        e.setThreadNamePrefix("chain-subscriber-");
        e.initialize();
        return e;
    }
}
