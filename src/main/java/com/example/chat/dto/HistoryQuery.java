package com.example.chat.dto;

import com.example.chat.model.HistorySource;
import lombok.Builder;
import lombok.Data;

/**
 * A history read. Cursors are exclusive epoch-millisecond bounds; a null source means
 * cache first, then archive.
 */
@Data
@Builder
public class HistoryQuery {
    private final String roomId;
    private final Integer limit;
    private final Long before;
    private final Long after;
    private final HistorySource source;
}
