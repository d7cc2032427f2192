package com.propertyBot.ratingsBot.gateway.model;

import java.util.List;

/**
 * A command line split into its command and arguments.
 */
public record ParsedCommand(BotCommand command, List<String> args) {
}
