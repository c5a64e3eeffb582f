package com.salestracker.platform.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the LINE Messaging API. Timeouts bound every push so one slow call cannot stall
 * a fan-out burst.
 */
@Configuration
public class LineMessagingConfig {

    @Bean
    public RestTemplate lineRestTemplate(RestTemplateBuilder builder, SalesTrackerProperties properties) {
        SalesTrackerProperties.Line line = properties.getLine();
        return builder
            .rootUri(line.getApiBaseUrl())
            .setConnectTimeout(line.getConnectTimeout())
            .setReadTimeout(line.getReadTimeout())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + line.getChannelAccessToken())
            .build();
    }
}
