package com.example.chat.service.auth;

import java.time.Instant;

/**
 * Set of revoked token ids. Entries disappear on their own once the token they mirror has expired.
 */
public interface TokenRevocationStore {

    void revoke(String tokenId, Instant expiresAt);

    boolean isRevoked(String tokenId);
}
