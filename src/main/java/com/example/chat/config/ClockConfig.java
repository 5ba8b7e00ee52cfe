package com.example.chat.config;

import com.example.chat.util.MonotonicClock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MonotonicClock messageClock(Clock clock) {
        return new MonotonicClock(clock);
    }
}
