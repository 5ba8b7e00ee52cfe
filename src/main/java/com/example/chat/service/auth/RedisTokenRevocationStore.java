package com.example.chat.service.auth;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
@Profile("redis")
@RequiredArgsConstructor
@Slf4j
public class RedisTokenRevocationStore implements TokenRevocationStore {

    private static final String BLACKLIST_KEY_PREFIX = "blacklist:";

    private final StringRedisTemplate stringRedisTemplate;
    private final Clock clock;

    @Override
    public void revoke(String tokenId, Instant expiresAt) {
        Duration ttl = Duration.between(clock.instant(), expiresAt);
        if (ttl.isNegative() || ttl.isZero()) {
            return;
        }
        stringRedisTemplate.opsForValue().set(BLACKLIST_KEY_PREFIX + tokenId, "1", ttl);
        log.debug("Token {} blacklisted in Redis for {}s", tokenId, ttl.toSeconds());
    }

    @Override
    public boolean isRevoked(String tokenId) {
        return Boolean.TRUE.equals(stringRedisTemplate.hasKey(BLACKLIST_KEY_PREFIX + tokenId));
    }
}
