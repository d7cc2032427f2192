package com.propertyBot.ratingsBot.gateway.service;

import com.propertyBot.ratingsBot.gateway.dto.BotResponse;
import com.propertyBot.ratingsBot.gateway.dto.CallbackRequest;
import com.propertyBot.ratingsBot.gateway.dto.CommandRequest;
import com.propertyBot.ratingsBot.gateway.exception.MissingChatIdException;
import com.propertyBot.ratingsBot.gateway.exception.RateLimitExceededException;
import com.propertyBot.ratingsBot.gateway.exception.UnknownCommandException;
import com.propertyBot.ratingsBot.gateway.model.BotCommand;
import com.propertyBot.ratingsBot.gateway.model.CollectingMessageSink;
import com.propertyBot.ratingsBot.gateway.model.ParsedCommand;
import com.propertyBot.ratingsBot.gateway.model.RequestContext;
import com.propertyBot.ratingsBot.gateway.util.ChatIdMasker;
import com.propertyBot.ratingsBot.orchestrator.model.MenuAction;
import com.propertyBot.ratingsBot.orchestrator.service.CommandOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Gateway service - handles all business logic for the gateway.
 *
 * Responsibilities:
 * - Extract and validate the chat id from the header
 * - Resolve the correlation id
 * - Enforce rate limiting
 * - Parse command text and callback data
 * - Forward to the orchestrator and collect its outbound messages
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private final CorrelationIdService correlationIdService;
    private final RateLimiter rateLimiter;
    private final CommandOrchestrator commandOrchestrator;

    /**
     * Processes a typed command such as {@code /top5} or {@code /complaints 7}.
     *
     * @throws MissingChatIdException     if the chat id header is missing
     * @throws RateLimitExceededException if the chat exceeded its rate limit
     * @throws UnknownCommandException    if the text names no known command
     */
    public BotResponse processCommand(CommandRequest request, String chatIdHeader, String correlationHeader) {
        RequestContext context = openRequest(chatIdHeader, correlationHeader);
        ParsedCommand parsed = parseCommand(request.getText());

        log.info("Command received - correlationId: {}, chatId: {}, command: {}",
                context.getCorrelationId(), ChatIdMasker.mask(context.getChatId()), parsed.command());

        CollectingMessageSink sink = new CollectingMessageSink();
        commandOrchestrator.handleCommand(parsed.command(), parsed.args(), context, sink);
        return respond(context, sink);
    }

    /**
     * Processes a menu button press.
     *
     * @throws UnknownCommandException if the callback data names no known action
     */
    public BotResponse processCallback(CallbackRequest request, String chatIdHeader, String correlationHeader) {
        RequestContext context = openRequest(chatIdHeader, correlationHeader);
        MenuAction action = MenuAction.fromCallbackData(request.getData())
                .orElseThrow(() -> {
                    log.warn("Unknown callback data - correlationId: {}, data: {}",
                            context.getCorrelationId(), request.getData());
                    return new UnknownCommandException("Unknown menu action: " + request.getData());
                });

        log.info("Callback received - correlationId: {}, chatId: {}, action: {}",
                context.getCorrelationId(), ChatIdMasker.mask(context.getChatId()), action);

        CollectingMessageSink sink = new CollectingMessageSink();
        commandOrchestrator.handleAction(action, context, sink);
        return respond(context, sink);
    }

    /**
     * Splits command text into command and arguments.
     * Accepts an optional leading slash and a {@code @botname} suffix, case-insensitively.
     */
    ParsedCommand parseCommand(String text) {
        if (text == null || text.isBlank()) {
            throw new UnknownCommandException("Command text is empty");
        }
        String[] tokens = text.trim().split("\\s+");
        String name = tokens[0];
        if (name.startsWith("/")) {
            name = name.substring(1);
        }
        int mention = name.indexOf('@');
        if (mention >= 0) {
            name = name.substring(0, mention);
        }
        String commandName = name;
        BotCommand command = BotCommand.fromName(commandName)
                .orElseThrow(() -> new UnknownCommandException("Unknown command: " + commandName));
        List<String> args = List.copyOf(Arrays.asList(tokens).subList(1, tokens.length));
        return new ParsedCommand(command, args);
    }

    private RequestContext openRequest(String chatIdHeader, String correlationHeader) {
        String chatId = extractAndValidateChatId(chatIdHeader);
        String correlationId = correlationIdService.resolveCorrelationId(correlationHeader);
        validateRateLimit(chatId, correlationId);
        return RequestContext.builder()
                .chatId(chatId)
                .correlationId(correlationId)
                .build();
    }

    private BotResponse respond(RequestContext context, CollectingMessageSink sink) {
        BotResponse response = BotResponse.builder()
                .correlationId(context.getCorrelationId())
                .messages(sink.getMessages())
                .build();
        log.debug("Responding - correlationId: {}, messages: {}", context.getCorrelationId(), response.getMessages().size());
        return response;
    }

    /**
     * @throws MissingChatIdException if chat id is missing or blank
     */
    private String extractAndValidateChatId(String chatIdHeader) {
        if (chatIdHeader == null || chatIdHeader.isBlank()) {
            log.error("Missing chatId header");
            throw new MissingChatIdException("Chat ID header is required");
        }
        return chatIdHeader.trim();
    }

    private void validateRateLimit(String chatId, String correlationId) {
        if (!rateLimiter.isAllowed(chatId)) {
            log.warn("Rate limit exceeded for chatId: {} (correlationId: {})",
                    ChatIdMasker.mask(chatId), correlationId);
            throw new RateLimitExceededException("Rate limit exceeded. Please try again later.");
        }
    }
}
