package com.example.chat.service.bus;

import com.example.chat.config.AppProperties;
import com.example.chat.exception.TransientInfrastructureException;
import com.example.chat.model.ChatMessage;
import com.example.chat.model.MessageType;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KafkaChatEventBusTest {

    @Mock
    private KafkaTemplate<String, ChatMessage> chatKafkaTemplate;

    @Mock
    private ConsumerFactory<String, ChatMessage> chatConsumerFactory;

    @Mock
    private CommonErrorHandler chatErrorHandler;

    @Mock
    private KafkaAdmin kafkaAdmin;

    private KafkaChatEventBus bus;

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
        AppProperties appProperties = new AppProperties();
        appProperties.getKafka().setSendTimeout(Duration.ofMillis(200));
        appProperties.getKafka().setPartitions(3);
        bus = new KafkaChatEventBus(chatKafkaTemplate, chatConsumerFactory, chatErrorHandler, kafkaAdmin, appProperties,
                Clock.systemUTC());
    }

    @Test
    @SuppressWarnings("unchecked")
    void publish_SendsToRoomTopicKeyedByRoom() {
        when(chatKafkaTemplate.send("chat_room_general", "general", message))
                .thenReturn(CompletableFuture.completedFuture(mock(SendResult.class)));

        bus.publish("general", message);

        verify(chatKafkaTemplate).send("chat_room_general", "general", message);
    }

    @Test
    void publish_WrapsBrokerFailure() {
        when(chatKafkaTemplate.send("chat_room_general", "general", message))
                .thenReturn(CompletableFuture.failedFuture(new TimeoutException("no leader")));

        assertThatThrownBy(() -> bus.publish("general", message))
                .isInstanceOf(TransientInfrastructureException.class)
                .hasMessageContaining("chat_room_general");
    }

    @Test
    void publish_GivesUpWhenAcknowledgementNeverArrives() {
        when(chatKafkaTemplate.send("chat_room_general", "general", message))
                .thenReturn(new CompletableFuture<>());

        assertThatThrownBy(() -> bus.publish("general", message))
                .isInstanceOf(TransientInfrastructureException.class);
    }

    @Test
    void createTopic_UsesConfiguredLayout() {
        bus.createTopic("project-x");

        ArgumentCaptor<NewTopic> topic = ArgumentCaptor.forClass(NewTopic.class);
        verify(kafkaAdmin).createOrModifyTopics(topic.capture());
        assertThat(topic.getValue().name()).isEqualTo("chat_room_project-x");
        assertThat(topic.getValue().numPartitions()).isEqualTo(3);
        assertThat(topic.getValue().replicationFactor()).isEqualTo((short) 1);
    }
}
