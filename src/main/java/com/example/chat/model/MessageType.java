package com.example.chat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageType {
    MESSAGE,
    SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return MessageType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
