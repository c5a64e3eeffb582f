package com.salestracker.platform.notification;

/**
 * A push to one chat target failed. The message was not delivered to that target.
 */
public class PushDeliveryException extends Exception {

    public PushDeliveryException(String message) {
        super(message);
    }

    public PushDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
