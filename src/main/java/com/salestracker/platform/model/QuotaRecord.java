package com.salestracker.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Daily send counter for one message category.
 */
@Entity
@Table(name = "notification_quota")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@IdClass(QuotaRecordId.class)
public class QuotaRecord {
    @Id
    @Column(name = "category", nullable = false)
    private String category;

    @Id
    @Column(name = "quota_day", nullable = false)
    private LocalDate day;

    @Column(name = "message_count", nullable = false)
    private long count;

    @Column(name = "last_target_id")
    private String lastTargetId;

    @Column(name = "updated_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;
}
