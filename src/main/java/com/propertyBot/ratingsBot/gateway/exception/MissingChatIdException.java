package com.propertyBot.ratingsBot.gateway.exception;

/**
 * Exception thrown when the chat id header is missing.
 */
public class MissingChatIdException extends RuntimeException {

    public MissingChatIdException(String message) {
        super(message);
    }
}
