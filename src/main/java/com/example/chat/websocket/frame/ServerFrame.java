package com.example.chat.websocket.frame;

import com.example.chat.model.ChatMessage;
import com.example.chat.model.MessageType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A frame pushed to a client. Bus messages keep their id, author and timestamp; frames generated
 * locally (welcome, errors, history) carry the time they were built.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerFrame {

    private final ServerFrameType type;
    private final String roomId;
    private final String id;
    private final String content;
    private final String userId;
    private final String username;
    private final List<ChatMessage> messages;
    private final String source;
    private final Long timestamp;

    public static ServerFrame of(ChatMessage message) {
        return ServerFrame.builder()
                .type(message.getType() == MessageType.SYSTEM ? ServerFrameType.SYSTEM : ServerFrameType.MESSAGE)
                .roomId(message.getRoomId())
                .id(message.getId())
                .content(message.getContent())
                .userId(message.getUserId())
                .username(message.getUsername())
                .timestamp(message.getTimestamp())
                .build();
    }

    public static ServerFrame system(String content, long timestamp) {
        return ServerFrame.builder().type(ServerFrameType.SYSTEM).content(content).timestamp(timestamp).build();
    }

    public static ServerFrame error(String content, long timestamp) {
        return ServerFrame.builder().type(ServerFrameType.ERROR).content(content).timestamp(timestamp).build();
    }

    public static ServerFrame history(String roomId, List<ChatMessage> messages, String source, long timestamp) {
        return ServerFrame.builder()
                .type(ServerFrameType.HISTORY)
                .roomId(roomId)
                .messages(messages)
                .source(source)
                .timestamp(timestamp)
                .build();
    }
}
