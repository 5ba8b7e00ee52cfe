package com.example.chat.service.gateway;

import com.example.chat.config.AppProperties;
import com.example.chat.dto.JoinHistory;
import com.example.chat.exception.TransientInfrastructureException;
import com.example.chat.model.ChatMessage;
import com.example.chat.model.MessageType;
import com.example.chat.model.UserIdentity;
import com.example.chat.service.bus.MessagePublisher;
import com.example.chat.service.cache.RecentMessageCache;
import com.example.chat.service.history.HistoryComposer;
import com.example.chat.service.hub.RoomHub;
import com.example.chat.service.hub.RoomSubscriber;
import com.example.chat.service.room.RoomService;
import com.example.chat.util.Constants;
import com.example.chat.util.Constants.ErrorText;
import com.example.chat.util.MonotonicClock;
import com.example.chat.websocket.frame.ClientFrame;
import com.example.chat.websocket.frame.ClientFrameVisitor;
import com.example.chat.websocket.frame.JoinFrame;
import com.example.chat.websocket.frame.LeaveFrame;
import com.example.chat.websocket.frame.SendFrame;
import com.example.chat.websocket.frame.ServerFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Session lifecycle and the join / leave / send intents.
 *
 * Every call here may block (bus, cache, JDBC) and is expected to run on the I/O scheduler.
 * Messages are never written to other sessions directly: they go to the bus and come back
 * through the {@link RoomHub} subscription, the sender included.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatGateway {

    private final SessionRegistry sessionRegistry;
    private final RoomHub roomHub;
    private final RoomService roomService;
    private final MessagePublisher messagePublisher;
    private final RecentMessageCache recentMessageCache;
    private final HistoryComposer historyComposer;
    private final AppProperties appProperties;
    private final MonotonicClock messageClock;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    /**
     * Registers a session for an already authenticated identity and greets it.
     */
    public ChatSession open(UserIdentity identity) {
        ChatSession session = new ChatSession(UUID.randomUUID().toString(), identity,
                appProperties.getWebsocket().getOutboundBufferSize(), clock.millis());
        session.markAuthenticated();
        sessionRegistry.register(session);
        session.activate();
        session.send(ServerFrame.system("Welcome, " + identity.getName() + "!", clock.millis()));
        log.info("Session {} opened for user {}", session.getId(), identity.getId());
        return session;
    }

    /**
     * Parses and dispatches one inbound text frame. Problems are reported to the client as error frames.
     */
    public void handle(ChatSession session, String payload) {
        if (!session.isActive()) {
            return;
        }
        ClientFrame frame;
        try {
            frame = objectMapper.readValue(payload, ClientFrame.class);
        } catch (InvalidTypeIdException e) {
            sendError(session, ErrorText.UNKNOWN_TYPE);
            return;
        } catch (JsonProcessingException e) {
            log.debug("Unreadable frame from session {}: {}", session.getId(), e.getOriginalMessage());
            sendError(session, ErrorText.INVALID_FORMAT);
            return;
        }
        if (frame == null) {
            sendError(session, ErrorText.INVALID_FORMAT);
            return;
        }

        try {
            frame.accept(new IntentDispatcher(session));
        } catch (RuntimeException e) {
            log.error("Failed to process {} for session {}: {}", frame.getClass().getSimpleName(), session.getId(), e.getMessage(), e);
            sendError(session, ErrorText.SERVICE_UNAVAILABLE);
        }
    }

    public void join(ChatSession session, String roomId) {
        if (roomId == null || !roomService.exists(roomId)) {
            sendError(session, ErrorText.ROOM_NOT_FOUND);
            return;
        }
        if (!session.addRoom(roomId)) {
            sendError(session, ErrorText.ALREADY_IN_ROOM);
            return;
        }
        try {
            roomHub.addSubscriber(roomId, new SessionSubscriber(session));
        } catch (RuntimeException e) {
            session.removeRoom(roomId);
            log.error("Session {} could not subscribe to room {}: {}", session.getId(), roomId, e.getMessage());
            sendError(session, ErrorText.JOIN_FAILED);
            return;
        }
        if (!session.isActive()) {
            // disconnect ran while we were subscribing
            session.removeRoom(roomId);
            roomHub.removeSubscriber(roomId, session.getId());
            return;
        }

        sendJoinHistory(session, roomId);
        publishNotice(roomId, session.getIdentity().getName() + " has joined the room");
        log.info("User {} ({}) joined room {}", session.getIdentity().getName(), session.getId(), roomId);
    }

    public void leave(ChatSession session, String roomId) {
        if (!session.removeRoom(roomId)) {
            return;
        }
        unsubscribe(session, roomId);
        publishNotice(roomId, session.getIdentity().getName() + " has left the room");
        log.info("User {} ({}) left room {}", session.getIdentity().getName(), session.getId(), roomId);
    }

    public void send(ChatSession session, String roomId, String content) {
        if (!session.isInRoom(roomId)) {
            sendError(session, ErrorText.NOT_IN_ROOM);
            return;
        }
        if (content == null || content.isBlank()) {
            sendError(session, ErrorText.EMPTY_MESSAGE);
            return;
        }
        if (content.length() > appProperties.getMessages().getMaxLength()) {
            sendError(session, ErrorText.MESSAGE_TOO_LONG);
            return;
        }

        UserIdentity author = session.getIdentity();
        ChatMessage message = ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .type(MessageType.MESSAGE)
                .roomId(roomId)
                .content(content)
                .userId(author.getId())
                .username(author.getName())
                .timestamp(messageClock.nextTimestamp())
                .build();
        try {
            messagePublisher.publish(message);
        } catch (TransientInfrastructureException e) {
            sendError(session, ErrorText.SEND_FAILED);
            return;
        }

        try {
            recentMessageCache.push(roomId, message);
        } catch (RuntimeException e) {
            log.warn("Consistency warning: message {} published but not cached for room {}: {}",
                    message.getId(), roomId, e.getMessage());
        }
    }

    /**
     * Leaves every joined room and forgets the session. Runs once per session, whatever triggered it.
     */
    public void disconnect(ChatSession session) {
        if (!session.beginClose()) {
            return;
        }
        for (String roomId : session.joinedRooms()) {
            try {
                leaveQuietly(session, roomId);
            } catch (RuntimeException e) {
                log.warn("Consistency warning: leaving room {} for session {} failed: {}", roomId, session.getId(), e.getMessage());
            }
        }
        sessionRegistry.unregister(session.getId());
        session.markClosed();
        log.info("Session {} ({}) closed", session.getId(), session.getIdentity().getName());
    }

    /**
     * Closes the connection; the handler's completion then runs {@link #disconnect}.
     */
    public void terminate(ChatSession session) {
        try {
            session.terminate();
        } finally {
            disconnect(session);
        }
    }

    private void leaveQuietly(ChatSession session, String roomId) {
        session.removeRoom(roomId);
        unsubscribe(session, roomId);
        publishNotice(roomId, session.getIdentity().getName() + " has left the room");
    }

    private void unsubscribe(ChatSession session, String roomId) {
        try {
            if (!roomHub.removeSubscriber(roomId, session.getId())) {
                log.warn("Consistency warning: session {} was not subscribed to room {}", session.getId(), roomId);
            }
        } catch (RuntimeException e) {
            log.warn("Consistency warning: failed to unsubscribe session {} from room {}: {}", session.getId(), roomId, e.getMessage());
        }
    }

    private void sendJoinHistory(ChatSession session, String roomId) {
        JoinHistory history = historyComposer.joinHistory(roomId);
        long now = clock.millis();
        session.send(ServerFrame.history(roomId, history.getRecent(), Constants.HistoryDelivery.RECENT, now));
        if (!history.getArchived().isEmpty()) {
            session.send(ServerFrame.history(roomId, history.getArchived(), Constants.HistoryDelivery.ARCHIVE, now));
        }
    }

    private void publishNotice(String roomId, String content) {
        ChatMessage notice = ChatMessage.system(UUID.randomUUID().toString(), roomId, content, messageClock.nextTimestamp());
        try {
            messagePublisher.publish(notice);
        } catch (TransientInfrastructureException e) {
            log.warn("System notice for room {} not published: {}", roomId, e.getMessage());
        }
    }

    private void sendError(ChatSession session, String text) {
        session.send(ServerFrame.error(text, clock.millis()));
    }

    private final class IntentDispatcher implements ClientFrameVisitor<Void> {

        private final ChatSession session;

        private IntentDispatcher(ChatSession session) {
            this.session = session;
        }

        @Override
        public Void visitJoin(JoinFrame frame) {
            join(session, frame.getRoomId());
            return null;
        }

        @Override
        public Void visitLeave(LeaveFrame frame) {
            leave(session, frame.getRoomId());
            return null;
        }

        @Override
        public Void visitSend(SendFrame frame) {
            send(session, frame.getRoomId(), frame.getContent());
            return null;
        }
    }

    private final class SessionSubscriber implements RoomSubscriber {

        private final ChatSession session;

        private SessionSubscriber(ChatSession session) {
            this.session = session;
        }

        @Override
        public String sessionId() {
            return session.getId();
        }

        @Override
        public boolean deliver(ChatMessage message) {
            return session.send(ServerFrame.of(message));
        }

        @Override
        public void onDeliveryFailed() {
            terminate(session);
        }
    }
}
