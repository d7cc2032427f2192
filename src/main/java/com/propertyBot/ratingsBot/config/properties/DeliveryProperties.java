package com.propertyBot.ratingsBot.config.properties;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "ratings-bot.delivery")
public class DeliveryProperties {

    /**
     * Safe per-message limit of the messaging channel, in Unicode code points.
     */
    @Min(1)
    private int maxMessageLength = 4000;
}
