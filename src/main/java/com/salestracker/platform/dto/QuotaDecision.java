package com.salestracker.platform.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Advisory answer of the quota gate. {@code reason} is set only when the send is refused.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaDecision {
    private boolean allowed;
    private long remaining;
    private boolean warning;
    private boolean critical;
    private String reason;
}
