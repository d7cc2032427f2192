package com.propertyBot.ratingsBot.gateway.exception;

/**
 * Exception thrown when inbound text or callback data names no known command or action.
 */
public class UnknownCommandException extends RuntimeException {

    public UnknownCommandException(String message) {
        super(message);
    }
}
