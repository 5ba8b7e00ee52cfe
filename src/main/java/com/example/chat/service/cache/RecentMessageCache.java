package com.example.chat.service.cache;

import com.example.chat.model.ChatMessage;

import java.util.List;

/**
 * Bounded, newest-first ring of the most recent messages of each room.
 */
public interface RecentMessageCache {

    /**
     * Pushes the message to the front of the room's ring and trims the ring to capacity.
     */
    void push(String roomId, ChatMessage message);

    /**
     * Returns at most {@code limit} messages of the room, newest first.
     */
    List<ChatMessage> recent(String roomId, int limit);

    int capacity();
}
