package com.salestracker.platform.dto;

import com.salestracker.platform.model.UnlockStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UnlockResult {
    private String userId;
    private String achievementId;
    private UnlockStatus status;

    public boolean isNewUnlock() {
        return status == UnlockStatus.UNLOCKED;
    }
}
