package com.example.chat.service.cache;

import com.example.chat.config.AppProperties;
import com.example.chat.model.ChatMessage;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

@Service
@Profile("!redis")
@Slf4j
public class CaffeineRecentMessageCache implements RecentMessageCache {

    private final Cache<String, Deque<ChatMessage>> recentMessagesCache;
    private final int capacity;

    public CaffeineRecentMessageCache(@Qualifier("recentMessagesCache") Cache<String, Deque<ChatMessage>> recentMessagesCache,
                                      AppProperties appProperties) {
        this.recentMessagesCache = recentMessagesCache;
        this.capacity = appProperties.getHistory().getCacheCapacity();
    }

    @Override
    public void push(String roomId, ChatMessage message) {
        Deque<ChatMessage> ring = recentMessagesCache.get(roomId, k -> new ArrayDeque<>(capacity + 1));
        synchronized (ring) {
            ring.addFirst(message);
            while (ring.size() > capacity) {
                ring.removeLast();
            }
        }
        log.debug("Cached message {} for room {}", message.getId(), roomId);
    }

    @Override
    public List<ChatMessage> recent(String roomId, int limit) {
        Deque<ChatMessage> ring = recentMessagesCache.getIfPresent(roomId);
        if (ring == null || limit <= 0) {
            return List.of();
        }
        synchronized (ring) {
            int size = Math.min(limit, ring.size());
            List<ChatMessage> slice = new ArrayList<>(size);
            Iterator<ChatMessage> it = ring.iterator();
            while (it.hasNext() && slice.size() < size) {
                slice.add(it.next());
            }
            return slice;
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }
}
