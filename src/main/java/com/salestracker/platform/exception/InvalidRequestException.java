package com.salestracker.platform.exception;

public class InvalidRequestException extends SalesTrackerException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }
}
