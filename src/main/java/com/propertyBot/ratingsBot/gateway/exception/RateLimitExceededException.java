package com.propertyBot.ratingsBot.gateway.exception;

/**
 * Exception thrown when a chat sends more commands than the rate limit allows.
 */
public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}
