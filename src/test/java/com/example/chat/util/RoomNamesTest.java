package com.example.chat.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomNamesTest {

    @Test
    void toRoomId_LowercasesAndReplacesNonAlphanumerics() {
        assertThat(RoomNames.toRoomId("Project X")).isEqualTo("project-x");
        assertThat(RoomNames.toRoomId("Team_Sync #2")).isEqualTo("team-sync--2");
        assertThat(RoomNames.toRoomId("general")).isEqualTo("general");
    }

    @Test
    void toDisplayName_CapitalizesFirstLetter() {
        assertThat(RoomNames.toDisplayName("general")).isEqualTo("General");
        assertThat(RoomNames.toDisplayName("")).isEmpty();
    }

    @Test
    void topicNamesRoundTrip() {
        String topic = RoomNames.toTopic("chat_room_", "tech");

        assertThat(topic).isEqualTo("chat_room_tech");
        assertThat(RoomNames.fromTopic("chat_room_", topic)).isEqualTo("tech");
    }

    @Test
    void fromTopic_RejectsForeignTopic() {
        assertThatThrownBy(() -> RoomNames.fromTopic("chat_room_", "orders"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
