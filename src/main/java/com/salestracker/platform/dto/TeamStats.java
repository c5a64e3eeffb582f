package com.salestracker.platform.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamStats {
    private long totalUsers;
    private long totalPoints;
    private long totalActivities;
    private long todayPoints;
    private long todayActivities;
    private long activeUsersToday;

    @Builder.Default
    private List<TopPerformer> topPerformers = new ArrayList<>();

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant calculatedAt;
}
