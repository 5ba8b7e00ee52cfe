package com.example.chat.exception;

/**
 * Custom unchecked exception thrown when the bus, the cache or the archive stays unavailable
 * after the retries configured for the call site have been exhausted.
 * The message is safe to show to clients; the cause carries the infrastructure detail.
 */
public class TransientInfrastructureException extends RuntimeException {

    public TransientInfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
