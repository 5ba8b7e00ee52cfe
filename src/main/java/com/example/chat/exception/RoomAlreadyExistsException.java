package com.example.chat.exception;

import lombok.Getter;

@Getter
public class RoomAlreadyExistsException extends RuntimeException {

    private final String roomId;

    public RoomAlreadyExistsException(String roomId) {
        super("Room already exists: " + roomId);
        this.roomId = roomId;
    }
}
