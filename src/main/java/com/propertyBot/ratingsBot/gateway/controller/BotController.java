package com.propertyBot.ratingsBot.gateway.controller;

import com.propertyBot.ratingsBot.gateway.dto.BotResponse;
import com.propertyBot.ratingsBot.gateway.dto.CallbackRequest;
import com.propertyBot.ratingsBot.gateway.dto.CommandRequest;
import com.propertyBot.ratingsBot.gateway.service.GatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Bot REST controller - thin HTTP layer between the messaging channel adapter and the bot.
 *
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Extract HTTP headers
 * - Delegate business logic to GatewayService
 */
@RestController
@RequestMapping("/api/v1/bot")
@RequiredArgsConstructor
public class BotController {

    static final String CHAT_ID_HEADER = "X-Chat-ID";
    static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    private final GatewayService gatewayService;

    /**
     * Typed command endpoint.
     *
     * @param request command text, e.g. "/top5"
     * @param chatIdHeader chat the command came from
     * @return messages to send back, in order
     */
    @PostMapping("/commands")
    public ResponseEntity<BotResponse> command(
            @Valid @RequestBody CommandRequest request,
            @RequestHeader(value = CHAT_ID_HEADER, required = false) String chatIdHeader,
            @RequestHeader(value = CORRELATION_ID_HEADER, required = false) String correlationHeader) {

        BotResponse response = gatewayService.processCommand(request, chatIdHeader, correlationHeader);
        return ResponseEntity.ok(response);
    }

    /**
     * Menu button endpoint.
     *
     * @param request callback data of the pressed button, e.g. "action_top5"
     */
    @PostMapping("/callbacks")
    public ResponseEntity<BotResponse> callback(
            @Valid @RequestBody CallbackRequest request,
            @RequestHeader(value = CHAT_ID_HEADER, required = false) String chatIdHeader,
            @RequestHeader(value = CORRELATION_ID_HEADER, required = false) String correlationHeader) {

        BotResponse response = gatewayService.processCallback(request, chatIdHeader, correlationHeader);
        return ResponseEntity.ok(response);
    }
}
