package com.example.chat.service.hub;

import com.example.chat.model.ChatMessage;

/**
 * A local recipient of a room's bus traffic, usually one WebSocket session.
 */
public interface RoomSubscriber {

    String sessionId();

    /**
     * Hands a message to the recipient without blocking.
     *
     * @return false if the recipient could not accept it
     */
    boolean deliver(ChatMessage message);

    /**
     * Called off the consumer thread after {@link #deliver} returned false or threw.
     */
    default void onDeliveryFailed() {
    }
}
