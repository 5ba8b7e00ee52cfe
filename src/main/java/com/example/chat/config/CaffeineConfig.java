package com.example.chat.config;

import com.example.chat.model.ChatMessage;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;

/**
 * In-process stores used when the {@code redis} profile is not active.
 */
@Configuration
@Profile("!redis")
public class CaffeineConfig {

    @Bean
    public Cache<String, Instant> revokedTokensCache(AppProperties appProperties, Clock clock) {
        return buildRevokedTokensCache(appProperties.getCache().getRevocations().getMaximumSize(), clock);
    }

    @Bean
    public Cache<String, Deque<ChatMessage>> recentMessagesCache(AppProperties appProperties) {
        AppProperties.Cache.RecentMessages settings = appProperties.getCache().getRecentMessages();
        return Caffeine.newBuilder()
                .maximumSize(settings.getMaximumRooms())
                .expireAfterAccess(settings.getExpireAfterAccess())
                .recordStats()
                .build();
    }

    /**
     * Each entry lives until the expiry instant it holds, mirroring the revoked token's own lifetime.
     */
    public static Cache<String, Instant> buildRevokedTokensCache(int maximumSize, Clock clock) {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new Expiry<String, Instant>() {
                    @Override
                    public long expireAfterCreate(String key, Instant expiresAt, long currentTime) {
                        return remainingNanos(expiresAt);
                    }

                    @Override
                    public long expireAfterUpdate(String key, Instant expiresAt, long currentTime, long currentDuration) {
                        return remainingNanos(expiresAt);
                    }

                    @Override
                    public long expireAfterRead(String key, Instant expiresAt, long currentTime, long currentDuration) {
                        return currentDuration;
                    }

                    private long remainingNanos(Instant expiresAt) {
                        return Math.max(0L, Duration.between(clock.instant(), expiresAt).toNanos());
                    }
                })
                .recordStats()
                .build();
    }
}
