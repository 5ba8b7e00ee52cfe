package com.example.chat.model;

public enum SessionState {
    CONNECTING,
    AUTHENTICATED,
    ACTIVE,
    CLOSING,
    CLOSED
}
