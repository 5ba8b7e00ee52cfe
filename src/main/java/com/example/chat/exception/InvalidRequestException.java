package com.example.chat.exception;

/**
 * Thrown for caller mistakes that retrying cannot fix: blank content, missing room name, and the like.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
