package com.github.stormino.transcoder.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final TranscoderProperties properties;

    @Bean(name = "progressScheduler")
    public ThreadPoolTaskScheduler progressScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getProgress().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("progress-");
        // Cancelled polls must not linger in the queue until their next tick
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
