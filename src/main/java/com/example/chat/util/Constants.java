package com.example.chat.util;

public final class Constants {

    private Constants() {}

    /** WebSocket close code sent when the handshake token is missing, invalid or revoked. */
    public static final int CLOSE_AUTHENTICATION_FAILED = 4001;

    public static final int ROOM_NAME_MAX_LENGTH = 100;

    /** Longest topic name a Kafka broker accepts. */
    public static final int TOPIC_NAME_MAX_LENGTH = 249;

    public static final String AUTH_IDENTITY_ATTRIBUTE = "chat.identity";
    public static final String AUTH_TOKEN_ATTRIBUTE = "chat.token";

    public static final class ErrorText {
        private ErrorText() {}

        public static final String ROOM_NOT_FOUND = "Room not found";
        public static final String ROOM_NAME_TOO_LONG = "Room name must be at most " + ROOM_NAME_MAX_LENGTH + " characters";
        public static final String ALREADY_IN_ROOM = "You are already in this room";
        public static final String NOT_IN_ROOM = "You are not in this room";
        public static final String EMPTY_MESSAGE = "Message cannot be empty";
        public static final String MESSAGE_TOO_LONG = "Message is too long";
        public static final String SEND_FAILED = "Failed to send message, please try again";
        public static final String JOIN_FAILED = "Failed to join room, please try again";
        public static final String UNKNOWN_TYPE = "Unknown message type";
        public static final String INVALID_FORMAT = "Invalid message format";
        public static final String SERVICE_UNAVAILABLE = "Service temporarily unavailable, please try again";
    }

    public static final class HistoryDelivery {
        private HistoryDelivery() {}

        public static final String RECENT = "recent";
        public static final String ARCHIVE = "archive";
    }
}
