package com.example.chat.service.bus;

import com.example.chat.exception.TransientInfrastructureException;
import com.example.chat.model.ChatMessage;
import com.example.chat.model.MessageType;
import com.example.chat.support.InMemoryChatEventBus;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessagePublisherTest {

    private InMemoryChatEventBus bus;
    private MessagePublisher publisher;

    private final ChatMessage message = ChatMessage.builder()
            .id("m1")
            .type(MessageType.MESSAGE)
            .roomId("general")
            .content("hi")
            .userId("user1")
            .username("Alice")
            .timestamp(1L)
            .build();

    @BeforeEach
    void setUp() {
        bus = new InMemoryChatEventBus();
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(TransientInfrastructureException.class)
                .build());
        publisher = new MessagePublisher(bus, retryRegistry);
    }

    @Test
    void publish_RoutesToTheMessageRoom() {
        publisher.publish(message);

        assertThat(bus.published("general")).containsExactly(message);
    }

    @Test
    void publish_RetriesTransientFailures() {
        bus.failNextPublishes(2);

        publisher.publish(message);

        assertThat(bus.publishAttempts()).isEqualTo(3);
        assertThat(bus.published("general")).containsExactly(message);
    }

    @Test
    void publish_ThrowsOnceRetriesAreExhausted() {
        bus.failNextPublishes(3);

        assertThatThrownBy(() -> publisher.publish(message))
                .isInstanceOf(TransientInfrastructureException.class);
        assertThat(bus.publishAttempts()).isEqualTo(3);
        assertThat(bus.published("general")).isEmpty();
    }
}
