package com.example.chat.service.bus;

import com.example.chat.exception.TransientInfrastructureException;
import com.example.chat.support.InMemoryChatEventBus;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BrokerConnectorTest {

    private InMemoryChatEventBus bus;
    private BrokerConnector connector;

    @BeforeEach
    void setUp() {
        bus = new InMemoryChatEventBus();
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(5)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(TransientInfrastructureException.class)
                .build());
        connector = new BrokerConnector(bus, retryRegistry);
    }

    @Test
    void connect_SucceedsOnFirstAttempt() {
        ConnectionOutcome outcome = connector.connect();

        assertThat(outcome.isConnected()).isTrue();
        assertThat(outcome.getAttempts()).isEqualTo(1);
        assertThat(outcome.getFailure()).isNull();
    }

    @Test
    void connect_RetriesUntilBrokerAnswers() {
        bus.failNextConnects(2);

        ConnectionOutcome outcome = connector.connect();

        assertThat(outcome.isConnected()).isTrue();
        assertThat(outcome.getAttempts()).isEqualTo(3);
    }

    @Test
    void connect_GivesUpAfterMaxAttempts() {
        bus.failNextConnects(10);

        ConnectionOutcome outcome = connector.connect();

        assertThat(outcome.isConnected()).isFalse();
        assertThat(outcome.getAttempts()).isEqualTo(5);
        assertThat(outcome.getFailure()).isInstanceOf(TransientInfrastructureException.class);
        assertThat(bus.connectAttempts()).isEqualTo(5);
    }
}
