package com.salestracker.platform.model;

public enum DeleteOutcome {
    DELETED,
    NOT_FOUND
}
