package com.propertyBot.ratingsBot.gateway.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Slash commands understood by the bot.
 */
public enum BotCommand {
    START("start"),
    MENU("menu"),
    RATINGS("ratings"),
    TOP5("top5"),
    TOP20("top20"),
    PROPERTIES("properties"),
    PROPERTY("property"),
    COMPLAINTS("complaints");

    private final String commandName;

    BotCommand(String commandName) {
        this.commandName = commandName;
    }

    public static Optional<BotCommand> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(command -> command.commandName.equals(normalized))
                .findFirst();
    }
}
