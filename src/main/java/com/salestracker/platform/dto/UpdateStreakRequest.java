package com.salestracker.platform.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateStreakRequest {
    @Min(value = 0, message = "currentStreak cannot be negative")
    private int currentStreak;

    @Min(value = 0, message = "longestStreak cannot be negative")
    private int longestStreak;

    private LocalDate lastActivityDate;
}
