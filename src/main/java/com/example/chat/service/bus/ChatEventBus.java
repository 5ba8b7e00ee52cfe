package com.example.chat.service.bus;

import com.example.chat.model.ChatMessage;

/**
 * Topic-per-room event bus. Every chat message, system notices included, goes through here;
 * sessions never deliver to each other directly.
 */
public interface ChatEventBus {

    /**
     * Publishes a message to the room's topic and waits for the broker acknowledgement.
     *
     * @throws com.example.chat.exception.TransientInfrastructureException if the broker did not acknowledge
     */
    void publish(String roomId, ChatMessage message);

    /**
     * Starts a consumer in the given group for one room topic.
     *
     * @param fromLatest deliver only messages published from this call on, ignoring committed offsets;
     *                   the call returns once the consumer owns its partitions
     */
    BusSubscription subscribe(String groupId, String roomId, boolean fromLatest, BusListener listener);

    void createTopic(String roomId);

    /**
     * @throws com.example.chat.exception.TransientInfrastructureException if the broker cannot be reached
     */
    void checkConnection();
}
