package com.adrelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler pool for @Scheduled jobs: PaymentPollJob, OrderExpiryJob, ReconciliationSweepJob,
 * ProvisioningRetryJob. Also exposes the UTC clock every time-dependent component reads.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(4);
        s.setThreadNamePrefix("scheduler-");
        s.initialize();
        return s;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
