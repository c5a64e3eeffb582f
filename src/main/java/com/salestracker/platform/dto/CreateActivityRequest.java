package com.salestracker.platform.dto;

import com.salestracker.platform.model.ActivityType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateActivityRequest {
    @NotBlank(message = "userId is required")
    private String userId;

    @NotNull(message = "activityType is required")
    private ActivityType activityType;

    @NotBlank(message = "title is required")
    @Size(max = 200, message = "title cannot exceed 200 characters")
    private String title;

    private String subtitle;

    @NotNull(message = "points is required")
    @Min(value = 0, message = "points cannot be negative")
    @Max(value = 1000, message = "points cannot exceed 1000")
    private Integer points;

    // Defaults to today in the engine time zone
    private LocalDate date;
}
