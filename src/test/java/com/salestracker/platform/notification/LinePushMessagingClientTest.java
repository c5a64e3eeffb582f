package com.salestracker.platform.notification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LinePushMessagingClientTest {

    private MockRestServiceServer server;
    private LinePushMessagingClient client;

    private final PushMessage message = new PushMessage("Somchai logged Call (+10 pts)",
        Map.of("type", "bubble"));

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri("https://api.line.me").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new LinePushMessagingClient(restTemplate);
    }

    @Test
    void testSend_PostsFlexMessageToPushEndpoint() throws Exception {
        server.expect(requestTo("https://api.line.me/v2/bot/message/push"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.to").value("g1"))
            .andExpect(jsonPath("$.messages[0].type").value("flex"))
            .andExpect(jsonPath("$.messages[0].altText").value("Somchai logged Call (+10 pts)"))
            .andExpect(jsonPath("$.messages[0].contents.type").value("bubble"))
            .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        client.send("g1", message);

        server.verify();
    }

    @Test
    void testSend_ServerErrorBecomesDeliveryFailure() {
        server.expect(requestTo("https://api.line.me/v2/bot/message/push"))
            .andRespond(withServerError());

        PushDeliveryException error = assertThrows(PushDeliveryException.class, () -> client.send("g1", message));

        assertTrue(error.getMessage().contains("g1"));
    }
}
