package com.propertyBot.ratingsBot.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.propertyBot.ratingsBot.delivery.model.MenuButton;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One message for the channel adapter to send. Images are serialized as base64.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutboundMessage {

    public enum Type {
        TEXT,
        PHOTO,
        MENU
    }

    private Type type;

    private String text;

    private byte[] image;

    private String contentType;

    private String caption;

    /**
     * Inline keyboard rows for {@link Type#MENU} messages.
     */
    private List<List<MenuButton>> keyboard;
}
