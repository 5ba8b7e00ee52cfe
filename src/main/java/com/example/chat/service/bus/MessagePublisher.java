package com.example.chat.service.bus;

import com.example.chat.exception.TransientInfrastructureException;
import com.example.chat.model.ChatMessage;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Publishes chat traffic to the bus with the {@code busPublish} retry policy.
 * Only broker failures are retried; anything else surfaces on the first attempt.
 */
@Service
@Slf4j
public class MessagePublisher {

    static final String RETRY_NAME = "busPublish";

    private final ChatEventBus chatEventBus;
    private final Retry retry;

    public MessagePublisher(ChatEventBus chatEventBus, RetryRegistry retryRegistry) {
        this.chatEventBus = chatEventBus;
        this.retry = retryRegistry.retry(RETRY_NAME);
    }

    /**
     * @throws TransientInfrastructureException once the retries are exhausted
     */
    public void publish(ChatMessage message) {
        try {
            retry.executeRunnable(() -> chatEventBus.publish(message.getRoomId(), message));
        } catch (TransientInfrastructureException e) {
            log.error("Publishing message {} to room {} failed after retries: {}",
                    message.getId(), message.getRoomId(), e.getMessage());
            throw e;
        }
    }
}
