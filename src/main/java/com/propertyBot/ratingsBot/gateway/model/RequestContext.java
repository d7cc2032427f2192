package com.propertyBot.ratingsBot.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request context passed through one pipeline run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    /**
     * Chat the command came from, supplied by the channel adapter.
     */
    private String chatId;

    /**
     * Correlation ID for request tracking in logs.
     */
    private String correlationId;
}
