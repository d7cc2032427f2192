package com.propertyBot.ratingsBot.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO: the messages to deliver, in order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BotResponse {

    private String correlationId;

    private List<OutboundMessage> messages;
}
