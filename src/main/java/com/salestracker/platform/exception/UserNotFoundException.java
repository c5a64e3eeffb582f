package com.salestracker.platform.exception;

public class UserNotFoundException extends SalesTrackerException {
    public UserNotFoundException(String userId) {
        super("User not found: " + userId, "USER_NOT_FOUND");
    }
}
