package com.example.chat.dto;

import com.example.chat.model.ChatMessage;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * History handed to a session on join, both parts oldest first.
 */
@Data
@AllArgsConstructor
public class JoinHistory {
    private final List<ChatMessage> recent;
    private final List<ChatMessage> archived;
}
