package com.propertyBot.ratingsBot.delivery.model;

/**
 * Inline keyboard button: the label shown and the callback data sent back when pressed.
 */
public record MenuButton(String label, String callbackData) {
}
