package com.salestracker.platform.notification;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one fan-out. {@code suppressed} counts eligible groups that were skipped because the
 * quota refused the send.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FanOutResult {
    private int eligibleGroups;
    private int sent;
    private int failed;
    private int suppressed;

    public static FanOutResult empty() {
        return new FanOutResult(0, 0, 0, 0);
    }
}
