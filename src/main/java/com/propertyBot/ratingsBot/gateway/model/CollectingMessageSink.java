package com.propertyBot.ratingsBot.gateway.model;

import com.propertyBot.ratingsBot.delivery.model.MenuButton;
import com.propertyBot.ratingsBot.delivery.model.MessageSink;
import com.propertyBot.ratingsBot.gateway.dto.OutboundMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects outbound messages for the HTTP response, in send order.
 * One instance per request.
 */
public class CollectingMessageSink implements MessageSink {

    private final List<OutboundMessage> messages = new ArrayList<>();

    @Override
    public void sendText(String text) {
        messages.add(OutboundMessage.builder()
                .type(OutboundMessage.Type.TEXT)
                .text(text)
                .build());
    }

    @Override
    public void sendPhoto(byte[] png, String caption) {
        messages.add(OutboundMessage.builder()
                .type(OutboundMessage.Type.PHOTO)
                .image(png)
                .contentType("image/png")
                .caption(caption)
                .build());
    }

    @Override
    public void sendMenu(String text, List<List<MenuButton>> keyboard) {
        messages.add(OutboundMessage.builder()
                .type(OutboundMessage.Type.MENU)
                .text(text)
                .keyboard(keyboard)
                .build());
    }

    public List<OutboundMessage> getMessages() {
        return List.copyOf(messages);
    }
}
