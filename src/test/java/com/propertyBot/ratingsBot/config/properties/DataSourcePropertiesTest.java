package com.propertyBot.ratingsBot.config.properties;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;

import static org.assertj.core.api.Assertions.assertThat;

class DataSourcePropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    void shouldFailStartupWithoutBaseUrl() {
        contextRunner.run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldBindEndpoints() {
        contextRunner
                .withPropertyValues(
                        "ratings-bot.data-source.base-url=http://api.test/properties",
                        "ratings-bot.data-source.timeout=3s")
                .run(context -> {
                    DataSourceProperties properties = context.getBean(DataSourceProperties.class);
                    assertThat(properties.resolvePropertiesUrl()).isEqualTo("http://api.test/properties");
                    assertThat(properties.isComplaintsConfigured()).isFalse();
                    assertThat(properties.getTimeout()).hasSeconds(3);
                });
    }

    @Test
    void shouldPreferDedicatedPropertiesUrl() {
        DataSourceProperties properties = new DataSourceProperties();
        properties.setBaseUrl("http://api.test/ratings");
        properties.setPropertiesUrl("http://api.test/listing");

        assertThat(properties.resolvePropertiesUrl()).isEqualTo("http://api.test/listing");
    }

    @Test
    void shouldOmitAuthHeaderWithoutKey() {
        HttpHeaders headers = new DataSourceProperties().buildHeaders();

        assertThat(headers.containsKey(HttpHeaders.AUTHORIZATION)).isFalse();
        assertThat(headers.getFirst(HttpHeaders.USER_AGENT)).isEqualTo("Property-Ratings-Bot/1.0");
    }

    @Test
    void shouldUseCustomKeyHeaderWithoutPrefix() {
        DataSourceProperties properties = new DataSourceProperties();
        properties.setApiKey("k-123");
        properties.setApiKeyHeader("X-Api-Key");
        properties.setApiKeyPrefix("");

        assertThat(properties.buildHeaders().getFirst("X-Api-Key")).isEqualTo("k-123");
    }

    @Configuration
    @EnableConfigurationProperties(DataSourceProperties.class)
    static class PropertiesConfiguration {
    }
}
