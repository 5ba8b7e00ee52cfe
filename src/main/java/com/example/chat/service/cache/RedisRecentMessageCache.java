package com.example.chat.service.cache;

import com.example.chat.config.AppProperties;
import com.example.chat.model.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Keeps each room's recent messages in the Redis list {@code chat-history:<roomId>}, newest at the head.
 */
@Service
@Profile("redis")
@Slf4j
public class RedisRecentMessageCache implements RecentMessageCache {

    private static final String CHAT_HISTORY_KEY_PREFIX = "chat-history:";

    private final RedisTemplate<String, ChatMessage> chatMessageRedisTemplate;
    private final int capacity;

    public RedisRecentMessageCache(RedisTemplate<String, ChatMessage> chatMessageRedisTemplate, AppProperties appProperties) {
        this.chatMessageRedisTemplate = chatMessageRedisTemplate;
        this.capacity = appProperties.getHistory().getCacheCapacity();
    }

    @Override
    public void push(String roomId, ChatMessage message) {
        String key = CHAT_HISTORY_KEY_PREFIX + roomId;
        chatMessageRedisTemplate.opsForList().leftPush(key, message);
        chatMessageRedisTemplate.opsForList().trim(key, 0, capacity - 1);
        log.debug("Cached message {} for room {} in Redis", message.getId(), roomId);
    }

    @Override
    public List<ChatMessage> recent(String roomId, int limit) {
        int size = Math.min(limit, capacity);
        if (size <= 0) {
            return List.of();
        }
        List<ChatMessage> messages = chatMessageRedisTemplate.opsForList()
                .range(CHAT_HISTORY_KEY_PREFIX + roomId, 0, size - 1);
        return messages != null ? messages : List.of();
    }

    @Override
    public int capacity() {
        return capacity;
    }
}
