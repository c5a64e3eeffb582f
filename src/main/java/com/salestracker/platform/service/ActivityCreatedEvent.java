package com.salestracker.platform.service;

import com.salestracker.platform.model.Activity;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Published once an activity is durably stored. Listeners run after the request has been answered.
 */
@Getter
@AllArgsConstructor
public class ActivityCreatedEvent {
    private final Activity activity;
}
