package com.example.chat.service.bus;

import com.example.chat.model.ChatMessage;

@FunctionalInterface
public interface BusListener {

    /**
     * @param roomId room id derived from the topic the message arrived on
     */
    void onMessage(String roomId, ChatMessage message);
}
