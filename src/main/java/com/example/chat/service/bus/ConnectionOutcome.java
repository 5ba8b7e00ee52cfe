package com.example.chat.service.bus;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of the startup broker connection loop.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ConnectionOutcome {

    private final boolean connected;
    private final int attempts;
    private final Throwable failure;

    public static ConnectionOutcome connected(int attempts) {
        return new ConnectionOutcome(true, attempts, null);
    }

    public static ConnectionOutcome failed(int attempts, Throwable failure) {
        return new ConnectionOutcome(false, attempts, failure);
    }
}
