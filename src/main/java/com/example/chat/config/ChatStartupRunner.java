package com.example.chat.config;

import com.example.chat.service.archive.MessageArchiver;
import com.example.chat.service.bus.BrokerConnector;
import com.example.chat.service.bus.ConnectionOutcome;
import com.example.chat.service.room.RoomService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Startup sequence: reach the broker, seed the default rooms, start the archive consumers.
 * A broker that stays unreachable through every attempt aborts startup.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChatStartupRunner implements ApplicationRunner {

    private final BrokerConnector brokerConnector;
    private final RoomService roomService;
    private final MessageArchiver messageArchiver;

    @Override
    public void run(ApplicationArguments args) {
        ConnectionOutcome outcome = brokerConnector.connect();
        if (!outcome.isConnected()) {
            throw new IllegalStateException(
                    "Kafka unavailable after " + outcome.getAttempts() + " attempt(s)", outcome.getFailure());
        }

        List<String> roomIds = roomService.ensureDefaultRooms();
        messageArchiver.start(roomIds);
        log.info("Chat relay ready with {} room(s)", roomIds.size());
    }
}
