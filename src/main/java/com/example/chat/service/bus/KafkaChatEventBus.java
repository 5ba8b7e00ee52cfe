package com.example.chat.service.bus;

import com.example.chat.config.AppProperties;
import com.example.chat.exception.TransientInfrastructureException;
import com.example.chat.model.ChatMessage;
import com.example.chat.util.RoomNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.OffsetAndTimestamp;
import org.apache.kafka.common.TopicPartition;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ConsumerAwareRebalanceListener;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
@Slf4j
@RequiredArgsConstructor
public class KafkaChatEventBus implements ChatEventBus {

    private final KafkaTemplate<String, ChatMessage> chatKafkaTemplate;
    private final ConsumerFactory<String, ChatMessage> chatConsumerFactory;
    private final CommonErrorHandler chatErrorHandler;
    private final KafkaAdmin kafkaAdmin;
    private final AppProperties appProperties;
    private final Clock clock;

    @Override
    public void publish(String roomId, ChatMessage message) {
        String topic = topicFor(roomId);
        long timeoutMs = appProperties.getKafka().getSendTimeout().toMillis();
        try {
            chatKafkaTemplate.send(topic, roomId, message).get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Published message {} to topic {}", message.getId(), topic);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInfrastructureException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new TransientInfrastructureException("Failed to publish message to " + topic, e);
        }
    }

    @Override
    public BusSubscription subscribe(String groupId, String roomId, boolean fromLatest, BusListener listener) {
        String topic = topicFor(roomId);
        long startMillis = clock.millis();
        CountDownLatch assigned = new CountDownLatch(1);

        ContainerProperties containerProperties = new ContainerProperties(topic);
        containerProperties.setGroupId(groupId);
        containerProperties.setAckMode(ContainerProperties.AckMode.RECORD);
        containerProperties.setMessageListener((MessageListener<String, ChatMessage>) record ->
                listener.onMessage(RoomNames.fromTopic(appProperties.getKafka().getTopicPrefix(), record.topic()), record.value()));
        containerProperties.setConsumerRebalanceListener(new StartPositionListener(fromLatest, startMillis, assigned));

        Properties overrides = new Properties();
        overrides.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, fromLatest ? "latest" : "earliest");
        containerProperties.setKafkaConsumerProperties(overrides);

        ConcurrentMessageListenerContainer<String, ChatMessage> container =
                new ConcurrentMessageListenerContainer<>(chatConsumerFactory, containerProperties);
        container.setConcurrency(1);
        container.setCommonErrorHandler(chatErrorHandler);
        container.setBeanName(groupId + "." + roomId);
        container.start();

        if (fromLatest) {
            awaitAssignment(container, assigned, topic, groupId);
        }
        log.info("Started consumer for topic {} in group {}", topic, groupId);
        return new KafkaBusSubscription(groupId, roomId, container);
    }

    private void awaitAssignment(ConcurrentMessageListenerContainer<String, ChatMessage> container,
                                 CountDownLatch assigned, String topic, String groupId) {
        long timeoutMs = appProperties.getKafka().getConnectTimeout().toMillis();
        try {
            if (!assigned.await(timeoutMs, TimeUnit.MILLISECONDS)) {
                // Records published meanwhile are still picked up by the timestamp seek.
                log.warn("No partition of {} assigned to group {} within {} ms", topic, groupId, timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            container.stop();
            throw new TransientInfrastructureException("Interrupted while subscribing to " + topic, e);
        }
    }

    @Override
    public void createTopic(String roomId) {
        AppProperties.Kafka kafka = appProperties.getKafka();
        kafkaAdmin.createOrModifyTopics(TopicBuilder.name(topicFor(roomId))
                .partitions(kafka.getPartitions())
                .replicas(kafka.getReplicationFactor())
                .build());
    }

    @Override
    public void checkConnection() {
        long timeoutMs = appProperties.getKafka().getConnectTimeout().toMillis();
        try (AdminClient adminClient = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            int nodes = adminClient.describeCluster().nodes().get(timeoutMs, TimeUnit.MILLISECONDS).size();
            log.info("Kafka cluster reachable with {} broker(s)", nodes);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInfrastructureException("Interrupted while connecting to Kafka", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new TransientInfrastructureException("Kafka cluster not reachable", e);
        }
    }

    private String topicFor(String roomId) {
        return RoomNames.toTopic(appProperties.getKafka().getTopicPrefix(), roomId);
    }

    /**
     * Positions a latest-offset subscription at the first record written after it was requested,
     * so nothing published while the group is still joining is skipped. Later rebalances resume
     * from committed offsets.
     */
    @RequiredArgsConstructor
    static class StartPositionListener implements ConsumerAwareRebalanceListener {

        private final boolean fromLatest;
        private final long startMillis;
        private final CountDownLatch assigned;
        private final AtomicBoolean positioned = new AtomicBoolean();

        @Override
        public void onPartitionsAssigned(Consumer<?, ?> consumer, Collection<TopicPartition> partitions) {
            if (fromLatest && !partitions.isEmpty() && positioned.compareAndSet(false, true)) {
                Map<TopicPartition, Long> query = new HashMap<>();
                partitions.forEach(partition -> query.put(partition, startMillis));
                Map<TopicPartition, OffsetAndTimestamp> offsets = consumer.offsetsForTimes(query);
                for (TopicPartition partition : partitions) {
                    OffsetAndTimestamp offset = offsets.get(partition);
                    if (offset != null) {
                        consumer.seek(partition, offset.offset());
                    } else {
                        consumer.seekToEnd(List.of(partition));
                    }
                }
            }
            assigned.countDown();
        }
    }

    @Slf4j
    @RequiredArgsConstructor
    static class KafkaBusSubscription implements BusSubscription {

        private final String groupId;
        private final String roomId;
        private final ConcurrentMessageListenerContainer<String, ChatMessage> container;

        @Override
        public String groupId() {
            return groupId;
        }

        @Override
        public String roomId() {
            return roomId;
        }

        @Override
        public boolean isActive() {
            return container.isRunning();
        }

        @Override
        public void close() {
            if (container.isRunning()) {
                container.stop();
                log.info("Stopped consumer for room {} in group {}", roomId, groupId);
            }
        }
    }
}
