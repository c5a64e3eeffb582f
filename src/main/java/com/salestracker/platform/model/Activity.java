package com.salestracker.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "activities", indexes = {
    @Index(name = "idx_activity_user_created", columnList = "user_id,created_at DESC"),
    @Index(name = "idx_activity_date", columnList = "activity_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Activity {
    public static final int MIN_POINTS = 0;
    public static final int MAX_POINTS = 1000;

    @Id
    @Column(name = "activity_id")
    private String activityId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "activity_type", nullable = false)
    private ActivityType activityType;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "subtitle")
    private String subtitle;

    @Column(name = "points", nullable = false)
    private int points;

    @Column(name = "activity_date", nullable = false)
    private LocalDate date;

    @Column(name = "created_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;
}
