package com.propertyBot.ratingsBot.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Remote property data source settings.
 * Bound once at startup; a blank base URL fails the application context.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ratings-bot.data-source")
public class DataSourceProperties {

    /**
     * Base endpoint serving the property list and {@code /{id}} sub-resources.
     */
    @NotBlank(message = "ratings-bot.data-source.base-url (MOCKAPI_URL) must be set")
    private String baseUrl;

    /**
     * Optional endpoint for the basic properties list. Falls back to {@link #baseUrl}.
     */
    private String propertiesUrl;

    /**
     * Optional complaints endpoint. Complaints are unavailable when blank.
     */
    private String complaintsUrl;

    private String apiKey;

    private String apiKeyHeader = HttpHeaders.AUTHORIZATION;

    private String apiKeyPrefix = "Bearer";

    private String userAgent = "Property-Ratings-Bot/1.0";

    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    public String resolvePropertiesUrl() {
        return hasText(propertiesUrl) ? propertiesUrl : baseUrl;
    }

    public boolean isComplaintsConfigured() {
        return hasText(complaintsUrl);
    }

    /**
     * Headers sent with every data source request, including the optional auth header.
     */
    public HttpHeaders buildHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.USER_AGENT, userAgent);
        if (hasText(apiKey)) {
            String prefix = hasText(apiKeyPrefix) ? apiKeyPrefix + " " : "";
            String headerName = hasText(apiKeyHeader) ? apiKeyHeader : HttpHeaders.AUTHORIZATION;
            headers.set(headerName, prefix + apiKey);
        }
        return headers;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
