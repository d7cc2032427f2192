package com.propertyBot.ratingsBot.delivery.model;

import java.util.List;

/**
 * Outbound side of the messaging channel for one conversation.
 */
public interface MessageSink {

    void sendText(String text);

    void sendPhoto(byte[] png, String caption);

    /**
     * Sends text together with an inline keyboard.
     *
     * @param keyboard rows of buttons, top row first
     */
    void sendMenu(String text, List<List<MenuButton>> keyboard);
}
