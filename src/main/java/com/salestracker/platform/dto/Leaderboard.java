package com.salestracker.platform.dto;

import com.salestracker.platform.model.LeaderboardPeriod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Leaderboard {
    private LeaderboardPeriod period;
    private LocalDate startDate;
    private LocalDate endDate;

    @Builder.Default
    private List<LeaderboardEntry> entries = new ArrayList<>();

    private int totalParticipants;

    public Optional<LeaderboardEntry> findEntry(String userId) {
        return entries.stream()
            .filter(entry -> entry.getUserId().equals(userId))
            .findFirst();
    }
}
