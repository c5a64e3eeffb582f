package com.salestracker.platform.model;

public enum UnlockStatus {
    UNLOCKED,
    ALREADY_UNLOCKED,
    USER_NOT_FOUND
}
