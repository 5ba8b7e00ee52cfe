package com.example.chat.websocket.frame;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ServerFrameType {
    SYSTEM,
    MESSAGE,
    ERROR,
    HISTORY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
