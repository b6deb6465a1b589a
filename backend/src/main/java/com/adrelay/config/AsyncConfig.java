package com.adrelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: poller-executor runs one poll cycle per receiving address off the scheduler threads.
 */
@Configuration
public class AsyncConfig {

    public static final String POLLER_EXECUTOR = "poller-executor";

    @Bean(name = POLLER_EXECUTOR)
    public Executor pollerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(64);
        e.setThreadNamePrefix("poller-");
        e.initialize();
        return e;
    }
}
