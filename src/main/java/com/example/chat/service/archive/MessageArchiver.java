package com.example.chat.service.archive;

import com.example.chat.config.AppProperties;
import com.example.chat.model.ChatMessage;
import com.example.chat.repository.MessageArchiveRepository;
import com.example.chat.service.bus.BusSubscription;
import com.example.chat.service.bus.ChatEventBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Storage consumer group. Persists every message of every tracked room topic, independently of
 * whether any session is in the room.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MessageArchiver {

    private final ChatEventBus chatEventBus;
    private final MessageArchiveRepository messageArchiveRepository;
    private final AppProperties appProperties;

    private final ConcurrentMap<String, BusSubscription> subscriptions = new ConcurrentHashMap<>();

    public void start(Collection<String> roomIds) {
        roomIds.forEach(this::track);
        log.info("Archiver tracking {} room topic(s) in group {}", subscriptions.size(), appProperties.getKafka().getArchiveGroupId());
    }

    /**
     * Starts archiving a room topic. Tracking an already tracked room does nothing.
     */
    public void track(String roomId) {
        subscriptions.computeIfAbsent(roomId, id -> chatEventBus.subscribe(
                appProperties.getKafka().getArchiveGroupId(), id, false, this::archive));
    }

    /**
     * Stores one delivered message under the room the topic belongs to.
     * Storage errors propagate so the listener container retries the record.
     *
     * @return false if the message was skipped as a redelivery or could not be read
     */
    public boolean archive(String roomId, ChatMessage message) {
        if (message == null || message.getId() == null) {
            log.warn("Skipping unreadable message on room {}", roomId);
            return false;
        }
        boolean stored = messageArchiveRepository.saveIfAbsent(message.withRoomId(roomId));
        if (stored) {
            log.debug("Archived message {} for room {}", message.getId(), roomId);
        } else {
            log.debug("Message {} for room {} already archived, skipping", message.getId(), roomId);
        }
        return stored;
    }

    public Set<String> trackedRooms() {
        return Set.copyOf(subscriptions.keySet());
    }

    public void stop() {
        subscriptions.forEach((roomId, subscription) -> {
            try {
                subscription.close();
            } catch (RuntimeException e) {
                log.warn("Failed to stop archive consumer for room {}: {}", roomId, e.getMessage());
            }
        });
        subscriptions.clear();
    }
}
