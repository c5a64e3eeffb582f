package com.salestracker.platform.notification;

public interface PushMessagingClient {

    void send(String targetId, PushMessage message) throws PushDeliveryException;
}
