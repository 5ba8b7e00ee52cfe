package com.example.chat.service.bus;

/**
 * Handle to a running consumer. Closing it stops the consumer; closing twice is harmless.
 */
public interface BusSubscription extends AutoCloseable {

    String groupId();

    String roomId();

    boolean isActive();

    @Override
    void close();
}
