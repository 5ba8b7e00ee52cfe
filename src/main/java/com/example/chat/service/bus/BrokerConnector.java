package com.example.chat.service.bus;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded connection loop run once at startup. Backoff and attempt count come from the
 * {@code brokerConnect} retry instance.
 */
@Component
@Slf4j
public class BrokerConnector {

    static final String RETRY_NAME = "brokerConnect";

    private final ChatEventBus chatEventBus;
    private final Retry retry;

    public BrokerConnector(ChatEventBus chatEventBus, RetryRegistry retryRegistry) {
        this.chatEventBus = chatEventBus;
        this.retry = retryRegistry.retry(RETRY_NAME);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Kafka connection attempt {} failed, retrying in {} ms: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    public ConnectionOutcome connect() {
        AtomicInteger attempts = new AtomicInteger();
        try {
            retry.executeRunnable(() -> {
                attempts.incrementAndGet();
                chatEventBus.checkConnection();
            });
            log.info("Connected to Kafka after {} attempt(s)", attempts.get());
            return ConnectionOutcome.connected(attempts.get());
        } catch (RuntimeException e) {
            log.error("Giving up on Kafka after {} attempt(s): {}", attempts.get(), e.getMessage());
            return ConnectionOutcome.failed(attempts.get(), e);
        }
    }
}
