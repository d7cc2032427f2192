package com.propertyBot.ratingsBot.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a pressed menu button, carrying the button's callback data.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CallbackRequest {

    @NotBlank(message = "data cannot be blank")
    private String data;
}
