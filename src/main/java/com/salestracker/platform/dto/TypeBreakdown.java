package com.salestracker.platform.dto;

import com.salestracker.platform.model.ActivityType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TypeBreakdown {
    private ActivityType type;
    private long count;
    private long points;
    private int percentage;
}
