package com.example.quorum.model;

/**
 * Exception thrown when JSON serialization or deserialization fails.
 */
public class SerializationException extends RuntimeException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
