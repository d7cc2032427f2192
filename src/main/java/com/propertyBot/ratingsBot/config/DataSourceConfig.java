package com.propertyBot.ratingsBot.config;

import com.propertyBot.ratingsBot.config.properties.DataSourceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Slf4j
@Configuration
public class DataSourceConfig {

    @Bean
    public RestClient propertyApiRestClient(RestClient.Builder builder, DataSourceProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getTimeout());
        requestFactory.setReadTimeout(properties.getTimeout());

        log.info("Property data source - baseUrl: {}, propertiesUrl: {}, complaints configured: {}, timeout: {}",
                properties.getBaseUrl(), properties.resolvePropertiesUrl(),
                properties.isComplaintsConfigured(), properties.getTimeout());

        return builder
                .requestFactory(requestFactory)
                .defaultHeaders(headers -> headers.addAll(properties.buildHeaders()))
                .build();
    }
}
