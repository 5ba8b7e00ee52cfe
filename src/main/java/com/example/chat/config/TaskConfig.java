package com.example.chat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Blocking work taken off the Netty event loops: token checks, Kafka publishes, cache and JDBC calls.
     */
    @Bean(destroyMethod = "")
    public Scheduler chatIoScheduler() {
        int threadCap = 100;
        int queuedTaskCap = 100000;
        return Schedulers.newBoundedElastic(threadCap, queuedTaskCap, "chat-io-");
    }
}
