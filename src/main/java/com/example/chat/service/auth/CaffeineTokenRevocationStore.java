package com.example.chat.service.auth;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Single-node revocation set. The cache evicts each entry at the token's expiry; the explicit
 * clock comparison keeps lookups exact between eviction sweeps.
 */
@Service
@Profile("!redis")
@Slf4j
public class CaffeineTokenRevocationStore implements TokenRevocationStore {

    private final Cache<String, Instant> revokedTokensCache;
    private final Clock clock;

    public CaffeineTokenRevocationStore(@Qualifier("revokedTokensCache") Cache<String, Instant> revokedTokensCache, Clock clock) {
        this.revokedTokensCache = revokedTokensCache;
        this.clock = clock;
    }

    @Override
    public void revoke(String tokenId, Instant expiresAt) {
        if (!expiresAt.isAfter(clock.instant())) {
            return;
        }
        revokedTokensCache.put(tokenId, expiresAt);
        log.debug("Token {} blacklisted in Caffeine until {}", tokenId, expiresAt);
    }

    @Override
    public boolean isRevoked(String tokenId) {
        Instant expiresAt = revokedTokensCache.getIfPresent(tokenId);
        return expiresAt != null && expiresAt.isAfter(clock.instant());
    }
}
