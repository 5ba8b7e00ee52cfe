package com.example.chat.websocket.frame;

public interface ClientFrameVisitor<R> {

    R visitJoin(JoinFrame frame);

    R visitLeave(LeaveFrame frame);

    R visitSend(SendFrame frame);
}
