package com.example.chat.util;

import java.util.Locale;

/**
 * Naming rules shared by room creation and the bus: room ids are derived from display names,
 * topic names from room ids.
 */
public final class RoomNames {

    private RoomNames() {}

    /**
     * Lowercases the name and replaces every character outside {@code [a-z0-9]} with {@code -}.
     * "Project X" becomes "project-x".
     */
    public static String toRoomId(String displayName) {
        return displayName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-");
    }

    /** "general" becomes "General". */
    public static String toDisplayName(String roomId) {
        if (roomId.isEmpty()) {
            return roomId;
        }
        return Character.toUpperCase(roomId.charAt(0)) + roomId.substring(1);
    }

    public static String toTopic(String topicPrefix, String roomId) {
        return topicPrefix + roomId;
    }

    public static String fromTopic(String topicPrefix, String topic) {
        if (!topic.startsWith(topicPrefix)) {
            throw new IllegalArgumentException("Topic " + topic + " does not carry prefix " + topicPrefix);
        }
        return topic.substring(topicPrefix.length());
    }
}
