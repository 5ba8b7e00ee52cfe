package com.example.chat;

import com.example.chat.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.reactive.ReactiveUserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for the Chat Relay service.
 *
 * The service provides:
 * - Authenticated WebSocket sessions with join/leave/send intents
 * - One shared Kafka subscription per room, fanned out to local sessions
 * - Recent history in a bounded hot cache, full history in a JDBC archive
 * - An archival consumer group persisting every room topic
 */
@SpringBootApplication(exclude = ReactiveUserDetailsServiceAutoConfiguration.class)
@EnableConfigurationProperties({
    AppProperties.class
})
public class ChatRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatRelayApplication.class, args);
    }
}
