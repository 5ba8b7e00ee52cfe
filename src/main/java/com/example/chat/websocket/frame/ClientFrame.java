package com.example.chat.websocket.frame;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;

/**
 * An intent sent by a client over the WebSocket. The {@code type} property selects the subtype;
 * an unregistered type fails deserialization.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = JoinFrame.class, name = "join"),
    @JsonSubTypes.Type(value = LeaveFrame.class, name = "leave"),
    @JsonSubTypes.Type(value = SendFrame.class, name = "message")
})
public abstract class ClientFrame {

    private String roomId;

    public abstract <R> R accept(ClientFrameVisitor<R> visitor);
}
