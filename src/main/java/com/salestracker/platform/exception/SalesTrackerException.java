package com.salestracker.platform.exception;

public class SalesTrackerException extends RuntimeException {
    private final String errorCode;

    public SalesTrackerException(String message) {
        super(message);
        this.errorCode = "SALES_TRACKER_ERROR";
    }

    public SalesTrackerException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public SalesTrackerException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "SALES_TRACKER_ERROR";
    }

    public String getErrorCode() {
        return errorCode;
    }
}
