package com.example.chat.service.gateway;

import com.example.chat.model.SessionState;
import com.example.chat.model.UserIdentity;
import com.example.chat.websocket.frame.ServerFrame;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-side state of one WebSocket connection.
 *
 * Frames are emitted from many threads (room consumers, the I/O scheduler, the liveness monitor),
 * so every emission goes through {@link #send}, which serializes access to the sink.
 */
@Slf4j
public class ChatSession {

    @Getter
    private final String id;
    @Getter
    private final UserIdentity identity;

    private final Set<String> joinedRooms = ConcurrentHashMap.newKeySet();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final Sinks.Many<ServerFrame> frames;
    private final Sinks.Many<Long> probes = Sinks.many().unicast().onBackpressureBuffer(Queues.<Long>get(16).get());

    @Getter
    private volatile long lastSeen;
    private volatile Runnable terminator = () -> { };

    public ChatSession(String id, UserIdentity identity, int outboundBufferSize, long now) {
        this.id = id;
        this.identity = identity;
        this.frames = Sinks.many().unicast().onBackpressureBuffer(Queues.<ServerFrame>get(outboundBufferSize).get());
        this.lastSeen = now;
    }

    public SessionState getState() {
        return state.get();
    }

    public boolean markAuthenticated() {
        return state.compareAndSet(SessionState.CONNECTING, SessionState.AUTHENTICATED);
    }

    public boolean activate() {
        return state.compareAndSet(SessionState.AUTHENTICATED, SessionState.ACTIVE);
    }

    public boolean isActive() {
        return state.get() == SessionState.ACTIVE;
    }

    /**
     * Moves the session to CLOSING. Only the first caller wins.
     */
    public boolean beginClose() {
        SessionState current = state.get();
        while (current != SessionState.CLOSING && current != SessionState.CLOSED) {
            if (state.compareAndSet(current, SessionState.CLOSING)) {
                return true;
            }
            current = state.get();
        }
        return false;
    }

    public synchronized void markClosed() {
        state.set(SessionState.CLOSED);
        frames.tryEmitComplete();
        probes.tryEmitComplete();
    }

    /**
     * @return false if the frame was rejected, either because the session is closed or its buffer is full
     */
    public synchronized boolean send(ServerFrame frame) {
        if (state.get() == SessionState.CLOSED) {
            return false;
        }
        Sinks.EmitResult result = frames.tryEmitNext(frame);
        if (result.isFailure()) {
            log.debug("Frame rejected for session {}: {}", id, result);
            return false;
        }
        return true;
    }

    public synchronized void requestPing(long tick) {
        if (state.get() != SessionState.CLOSED) {
            probes.tryEmitNext(tick);
        }
    }

    public Flux<ServerFrame> frames() {
        return frames.asFlux();
    }

    public Flux<Long> pings() {
        return probes.asFlux();
    }

    public void markAlive(long now) {
        lastSeen = now;
    }

    public boolean addRoom(String roomId) {
        return joinedRooms.add(roomId);
    }

    public boolean removeRoom(String roomId) {
        return joinedRooms.remove(roomId);
    }

    public boolean isInRoom(String roomId) {
        return roomId != null && joinedRooms.contains(roomId);
    }

    public Set<String> joinedRooms() {
        return Set.copyOf(joinedRooms);
    }

    /**
     * Installs the action that closes the underlying connection.
     */
    public void onTerminate(Runnable terminator) {
        this.terminator = terminator;
    }

    public void terminate() {
        terminator.run();
    }
}
