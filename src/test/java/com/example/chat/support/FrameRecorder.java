package com.example.chat.support;

import com.example.chat.service.gateway.ChatSession;
import com.example.chat.websocket.frame.ServerFrame;
import com.example.chat.websocket.frame.ServerFrameType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Drains a session's outbound frames the way the WebSocket handler would.
 */
public class FrameRecorder {

    private final List<ServerFrame> frames = new CopyOnWriteArrayList<>();
    private final AtomicBoolean completed = new AtomicBoolean();

    public static FrameRecorder attach(ChatSession session) {
        FrameRecorder recorder = new FrameRecorder();
        session.frames().subscribe(recorder.frames::add, e -> { }, () -> recorder.completed.set(true));
        return recorder;
    }

    public List<ServerFrame> all() {
        return List.copyOf(frames);
    }

    public List<ServerFrame> ofType(ServerFrameType type) {
        return frames.stream().filter(f -> f.getType() == type).collect(Collectors.toList());
    }

    public List<String> contents(ServerFrameType type) {
        return ofType(type).stream().map(ServerFrame::getContent).collect(Collectors.toList());
    }

    public ServerFrame last() {
        return frames.get(frames.size() - 1);
    }

    public boolean isCompleted() {
        return completed.get();
    }
}
