package com.example.chat.dto;

import com.example.chat.model.ChatMessage;
import com.example.chat.model.HistorySource;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class HistoryMessage {
    @JsonUnwrapped
    private final ChatMessage message;
    private final HistorySource source;
}
