package com.example.chat.websocket.frame;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class LeaveFrame extends ClientFrame {

    @Override
    public <R> R accept(ClientFrameVisitor<R> visitor) {
        return visitor.visitLeave(this);
    }
}
