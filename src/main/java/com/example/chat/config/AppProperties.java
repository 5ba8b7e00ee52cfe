package com.example.chat.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "chat")
@Data
@Validated
public class AppProperties {

    private final Pod pod = new Pod();
    private final Jwt jwt = new Jwt();
    private final WebSocket websocket = new WebSocket();
    private final History history = new History();
    private final Messages messages = new Messages();
    private final Kafka kafka = new Kafka();
    private final Rooms rooms = new Rooms();
    private final Cache cache = new Cache();

    /**
     * Fixed identity table, keyed by login name.
     */
    private Map<String, UserEntry> users = new LinkedHashMap<>();

    @Data
    public static class Pod {
        @NotBlank
        private String id = "chat-pod-local";
    }

    @Data
    public static class Jwt {
        /** HMAC secret, at least 32 bytes for HS256. */
        @NotBlank
        private String secret = "change-me-change-me-change-me-change-me";
        @NotBlank
        private String issuer = "chat-relay";
        @NotNull
        private Duration ttl = Duration.ofHours(1);
    }

    @Data
    public static class WebSocket {
        @NotBlank
        private String path = "/ws";
        @NotNull
        private Duration pingInterval = Duration.ofSeconds(30);
        @Positive
        private int missedPingsAllowed = 2;
        /** Frames buffered per session before delivery to it counts as failed. */
        @Positive
        private int outboundBufferSize = 1024;
    }

    @Data
    public static class History {
        /** Number of most recent messages kept per room in the hot cache. */
        @Positive
        private int cacheCapacity = 50;
        @Positive
        private int defaultLimit = 50;
        @Positive
        private int maxLimit = 100;
    }

    @Data
    public static class Messages {
        @Positive
        private int maxLength = 4000;
    }

    @Data
    public static class Kafka {
        @NotBlank
        private String topicPrefix = "chat_room_";
        @Positive
        private int partitions = 1;
        @Positive
        private short replicationFactor = 1;
        @NotBlank
        private String archiveGroupId = "chat-storage-group";
        @NotBlank
        private String roomGroupPrefix = "chat-room-";
        @NotNull
        private Duration sendTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        private final ConsumerRetry consumerRetry = new ConsumerRetry();

        @Data
        public static class ConsumerRetry {
            @NotNull
            private Duration initialInterval = Duration.ofSeconds(1);
            @Positive
            private double multiplier = 2.0;
            @NotNull
            private Duration maxInterval = Duration.ofSeconds(30);
            @Min(0)
            private int maxRetries = 5;
        }
    }

    @Data
    public static class Rooms {
        private List<String> defaults = new ArrayList<>(List.of("general", "random", "tech"));
    }

    @Data
    public static class Cache {
        private final Revocations revocations = new Revocations();
        private final RecentMessages recentMessages = new RecentMessages();

        @Data
        public static class Revocations {
            @Positive
            private int maximumSize = 100000;
        }

        @Data
        public static class RecentMessages {
            @Positive
            private int maximumRooms = 10000;
            @NotNull
            private Duration expireAfterAccess = Duration.ofHours(24);
        }
    }

    @Data
    public static class UserEntry {
        @NotBlank
        private String password;
        @NotBlank
        private String name;
    }
}
