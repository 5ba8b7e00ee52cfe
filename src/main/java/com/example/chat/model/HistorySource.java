package com.example.chat.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The tier that served a message on a history read.
 */
public enum HistorySource {
    CACHE("cache", "redis"),
    ARCHIVE("archive", "mongodb");

    private final String wireName;
    private final String alias;

    HistorySource(String wireName, String alias) {
        this.wireName = wireName;
        this.alias = alias;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a tier hint from a query parameter. Blank means "combined".
     */
    public static Optional<HistorySource> fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        String normalized = hint.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(normalized) || s.alias.equals(normalized))
                .findFirst();
    }
}
