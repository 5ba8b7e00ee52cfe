package com.example.chat.health;

import com.example.chat.service.archive.MessageArchiver;
import com.example.chat.service.bus.ChatEventBus;
import com.example.chat.service.gateway.SessionRegistry;
import com.example.chat.service.hub.RoomHub;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports local session and room state plus broker reachability.
 */
@Component
public class ChatHealthIndicator implements HealthIndicator {

    private final SessionRegistry sessionRegistry;
    private final RoomHub roomHub;
    private final MessageArchiver messageArchiver;
    private final ChatEventBus chatEventBus;

    public ChatHealthIndicator(SessionRegistry sessionRegistry,
                               RoomHub roomHub,
                               MessageArchiver messageArchiver,
                               ChatEventBus chatEventBus) {
        this.sessionRegistry = sessionRegistry;
        this.roomHub = roomHub;
        this.messageArchiver = messageArchiver;
        this.chatEventBus = chatEventBus;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sessions", sessionRegistry.size());
        details.put("subscribedRooms", roomHub.subscriberCounts());
        details.put("archivedRooms", messageArchiver.trackedRooms().size());

        boolean kafkaHealthy = checkKafkaConnectivity(details);
        Health.Builder healthBuilder = kafkaHealthy ? Health.up() : Health.down();
        return healthBuilder.withDetails(details).build();
    }

    private boolean checkKafkaConnectivity(Map<String, Object> details) {
        try {
            chatEventBus.checkConnection();
            details.put("kafkaStatus", "UP");
            return true;
        } catch (RuntimeException e) {
            details.put("kafkaStatus", "DOWN");
            details.put("kafkaError", e.getMessage());
            return false;
        }
    }
}
