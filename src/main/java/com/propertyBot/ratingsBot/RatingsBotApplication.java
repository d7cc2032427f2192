package com.propertyBot.ratingsBot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RatingsBotApplication {

    public static void main(String[] args) {
        // Charts are rendered off-screen
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(RatingsBotApplication.class, args);
    }
}
