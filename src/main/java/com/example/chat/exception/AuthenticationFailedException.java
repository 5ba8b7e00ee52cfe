package com.example.chat.exception;

/**
 * Missing, malformed, expired or revoked credentials. Rejected at the boundary and never retried.
 */
public class AuthenticationFailedException extends RuntimeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
