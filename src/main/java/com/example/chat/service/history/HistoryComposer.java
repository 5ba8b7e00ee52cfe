package com.example.chat.service.history;

import com.example.chat.config.AppProperties;
import com.example.chat.dto.HistoryMessage;
import com.example.chat.dto.HistoryPage;
import com.example.chat.dto.HistoryQuery;
import com.example.chat.dto.JoinHistory;
import com.example.chat.dto.Pagination;
import com.example.chat.model.ChatMessage;
import com.example.chat.model.HistorySource;
import com.example.chat.repository.MessageArchiveRepository;
import com.example.chat.service.cache.RecentMessageCache;
import com.example.chat.service.room.RoomService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads room history from the hot cache and the archive.
 *
 * In combined mode the cache serves the newest part of the page. The archive fills the rest, but only
 * with messages not newer than the oldest cached entry taken, so the two tiers meet without a gap.
 * Archive rows whose id is already on the page are dropped at the boundary.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HistoryComposer {

    private final RecentMessageCache recentMessageCache;
    private final MessageArchiveRepository messageArchiveRepository;
    private final RoomService roomService;
    private final AppProperties appProperties;

    /**
     * @throws com.example.chat.exception.ResourceNotFoundException if the room does not exist
     */
    public HistoryPage history(HistoryQuery query) {
        String roomId = query.getRoomId();
        roomService.get(roomId);
        int limit = clampLimit(query.getLimit());

        List<HistoryMessage> page;
        if (query.getSource() == HistorySource.CACHE) {
            page = tag(fromCache(roomId, query, limit), HistorySource.CACHE);
        } else if (query.getSource() == HistorySource.ARCHIVE) {
            page = tag(messageArchiveRepository.findNewestFirst(roomId, query.getBefore(), query.getAfter(), limit),
                    HistorySource.ARCHIVE);
        } else {
            page = combined(roomId, query, limit);
        }

        page.sort((a, b) -> ChatMessage.NEWEST_FIRST.compare(a.getMessage(), b.getMessage()));
        if (page.size() > limit) {
            page = new ArrayList<>(page.subList(0, limit));
        }
        return new HistoryPage(page, paginate(page, limit));
    }

    /**
     * Recent messages sent to a session when it joins a room. The archive part is only read when the
     * cache holds fewer messages than its capacity; archive failures leave it empty.
     */
    public JoinHistory joinHistory(String roomId) {
        int capacity = recentMessageCache.capacity();
        List<ChatMessage> recent;
        try {
            recent = recentMessageCache.recent(roomId, capacity);
        } catch (RuntimeException e) {
            log.warn("Hot cache unavailable while loading join history for room {}: {}", roomId, e.getMessage());
            recent = List.of();
        }

        List<ChatMessage> archived = List.of();
        if (recent.size() < capacity) {
            Long olderThan = recent.isEmpty() ? null : recent.get(recent.size() - 1).getTimestamp();
            try {
                archived = messageArchiveRepository.findNewestFirst(roomId, olderThan, null, capacity - recent.size());
            } catch (DataAccessException e) {
                log.error("Failed to load archived history for room {}: {}", roomId, e.getMessage());
            }
        }
        return new JoinHistory(oldestFirst(recent), oldestFirst(archived));
    }

    int clampLimit(Integer requested) {
        AppProperties.History history = appProperties.getHistory();
        if (requested == null) {
            return Math.min(history.getDefaultLimit(), history.getMaxLimit());
        }
        return Math.max(1, Math.min(requested, history.getMaxLimit()));
    }

    private List<HistoryMessage> combined(String roomId, HistoryQuery query, int limit) {
        List<ChatMessage> cached = fromCache(roomId, query, limit);
        List<HistoryMessage> page = tag(cached, HistorySource.CACHE);
        if (cached.size() >= limit) {
            return page;
        }

        // not newer than the oldest cached entry, so the archive cannot fill a hole above it
        Long olderThan = cached.isEmpty()
                ? query.getBefore()
                : cached.get(cached.size() - 1).getTimestamp() + 1;
        Set<String> seen = cached.stream().map(ChatMessage::getId).collect(Collectors.toCollection(HashSet::new));
        List<ChatMessage> archived = messageArchiveRepository.findNewestFirst(roomId, olderThan, query.getAfter(), limit);
        for (ChatMessage message : archived) {
            if (page.size() >= limit) {
                break;
            }
            if (seen.add(message.getId())) {
                page.add(new HistoryMessage(message, HistorySource.ARCHIVE));
            }
        }
        return page;
    }

    private List<ChatMessage> fromCache(String roomId, HistoryQuery query, int limit) {
        return recentMessageCache.recent(roomId, recentMessageCache.capacity()).stream()
                .filter(m -> query.getBefore() == null || m.getTimestamp() < query.getBefore())
                .filter(m -> query.getAfter() == null || m.getTimestamp() > query.getAfter())
                .limit(limit)
                .collect(Collectors.toList());
    }

    private static List<HistoryMessage> tag(List<ChatMessage> messages, HistorySource source) {
        List<HistoryMessage> tagged = new ArrayList<>(messages.size());
        messages.forEach(m -> tagged.add(new HistoryMessage(m, source)));
        return tagged;
    }

    private static Pagination paginate(List<HistoryMessage> page, int limit) {
        if (page.isEmpty()) {
            return new Pagination(0, false, null, null);
        }
        return new Pagination(page.size(), page.size() == limit,
                page.get(page.size() - 1).getMessage().getTimestamp(),
                page.get(0).getMessage().getTimestamp());
    }

    private static List<ChatMessage> oldestFirst(List<ChatMessage> newestFirst) {
        List<ChatMessage> copy = new ArrayList<>(newestFirst);
        Collections.reverse(copy);
        return copy;
    }
}
