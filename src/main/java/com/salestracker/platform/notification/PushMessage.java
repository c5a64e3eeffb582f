package com.salestracker.platform.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A rich (flex) chat message: a plain-text fallback plus the bubble layout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PushMessage {
    private String altText;
    private Map<String, Object> contents;
}
