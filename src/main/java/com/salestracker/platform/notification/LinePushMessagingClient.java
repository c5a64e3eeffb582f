package com.salestracker.platform.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushes flex messages through the LINE Messaging API push endpoint.
 */
@Component
public class LinePushMessagingClient implements PushMessagingClient {

    private static final Logger logger = LoggerFactory.getLogger(LinePushMessagingClient.class);

    static final String PUSH_PATH = "/v2/bot/message/push";

    private final RestTemplate restTemplate;

    @Autowired
    public LinePushMessagingClient(@Qualifier("lineRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public void send(String targetId, PushMessage message) throws PushDeliveryException {
        Map<String, Object> flex = new LinkedHashMap<>();
        flex.put("type", "flex");
        flex.put("altText", message.getAltText());
        flex.put("contents", message.getContents());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("to", targetId);
        body.put("messages", List.of(flex));

        try {
            restTemplate.postForEntity(PUSH_PATH, body, String.class);
            logger.debug("Pushed message to {}", targetId);
        } catch (RestClientException e) {
            throw new PushDeliveryException("Push to " + targetId + " failed: " + e.getMessage(), e);
        }
    }
}
