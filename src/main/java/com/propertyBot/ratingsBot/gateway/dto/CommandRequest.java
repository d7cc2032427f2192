package com.propertyBot.ratingsBot.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a typed command, e.g. {@code "/property 3"}.
 * The chat id comes from the HTTP header.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommandRequest {

    @NotBlank(message = "text cannot be blank")
    private String text;
}
