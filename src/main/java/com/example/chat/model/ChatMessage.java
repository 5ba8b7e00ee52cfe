package com.example.chat.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Comparator;

/**
 * A chat message as it travels over the bus, sits in the hot cache and is archived.
 * Instances are never mutated once published.
 */
@Value
@Builder
@Jacksonized
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatMessage {

    /** Newest first: timestamp descending, then id descending. */
    public static final Comparator<ChatMessage> NEWEST_FIRST = Comparator
            .comparingLong(ChatMessage::getTimestamp)
            .thenComparing(ChatMessage::getId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .reversed();

    String id;
    MessageType type;
    String roomId;
    String content;
    String userId;
    String username;
    long timestamp;

    public static ChatMessage system(String id, String roomId, String content, long timestamp) {
        return ChatMessage.builder()
                .id(id)
                .type(MessageType.SYSTEM)
                .roomId(roomId)
                .content(content)
                .timestamp(timestamp)
                .build();
    }
}
