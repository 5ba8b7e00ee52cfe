package com.example.chat.config;

import com.example.chat.service.archive.MessageArchiver;
import com.example.chat.service.gateway.ChatGateway;
import com.example.chat.service.gateway.ChatSession;
import com.example.chat.service.gateway.SessionRegistry;
import com.example.chat.service.hub.RoomHub;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

/**
 * Graceful shutdown: sessions are closed (leaving their rooms), room subscriptions and archive
 * consumers are stopped, then the I/O scheduler is disposed.
 */
@Component
@Slf4j
public class ShutdownManager {

    private final SessionRegistry sessionRegistry;
    private final ChatGateway chatGateway;
    private final RoomHub roomHub;
    private final MessageArchiver messageArchiver;
    private final Scheduler chatIoScheduler;

    public ShutdownManager(SessionRegistry sessionRegistry, ChatGateway chatGateway, RoomHub roomHub,
                           MessageArchiver messageArchiver, @Qualifier("chatIoScheduler") Scheduler chatIoScheduler) {
        this.sessionRegistry = sessionRegistry;
        this.chatGateway = chatGateway;
        this.roomHub = roomHub;
        this.messageArchiver = messageArchiver;
        this.chatIoScheduler = chatIoScheduler;
    }

    @PreDestroy
    public void onShutdown() {
        log.info("Initiating graceful shutdown...");

        for (ChatSession session : sessionRegistry.all()) {
            try {
                chatGateway.terminate(session);
            } catch (RuntimeException e) {
                log.warn("Failed to close session {} during shutdown: {}", session.getId(), e.getMessage());
            }
        }
        roomHub.shutdown();
        messageArchiver.stop();

        log.info("Disposing chat I/O scheduler...");
        chatIoScheduler.dispose();

        log.info("Graceful shutdown completed.");
    }
}
