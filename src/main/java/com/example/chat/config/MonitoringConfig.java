package com.example.chat.config;

import com.example.chat.service.gateway.SessionRegistry;
import com.example.chat.service.hub.RoomHub;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the chat relay.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder chatMetrics(SessionRegistry sessionRegistry, RoomHub roomHub) {
        return registry -> {
            Gauge.builder("chat.sessions.active", sessionRegistry, SessionRegistry::size)
                    .description("Open WebSocket sessions on this pod")
                    .register(registry);
            Gauge.builder("chat.rooms.subscribed", roomHub, hub -> hub.activeRooms().size())
                    .description("Rooms with a running bus subscription on this pod")
                    .register(registry);

            registry.counter("chat.errors", "type", "gateway");
            registry.counter("chat.errors", "type", "history");
            registry.counter("chat.errors", "type", "archive");
            registry.counter("chat.errors", "type", "cache");
            registry.counter("chat.errors", "type", "database");
        };
    }

    @Bean
    public ChatMetricsCollector chatMetricsCollector(MeterRegistry registry) {
        return new ChatMetricsCollector(registry);
    }

    /**
     * Lazily registered counters and timers keyed by name and tags.
     */
    public static class ChatMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

        public ChatMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment();
        }

        public void recordTimer(String name, long duration, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k -> Timer.builder(name).tags(tags).register(registry))
                    .record(duration, TimeUnit.MILLISECONDS);
        }

        public long getCounterValue(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            Counter counter = counters.get(key);
            return counter != null ? (long) counter.count() : 0;
        }
    }
}
