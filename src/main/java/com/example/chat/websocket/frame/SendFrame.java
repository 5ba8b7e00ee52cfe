package com.example.chat.websocket.frame;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class SendFrame extends ClientFrame {

    private String content;

    @Override
    public <R> R accept(ClientFrameVisitor<R> visitor) {
        return visitor.visitSend(this);
    }
}
