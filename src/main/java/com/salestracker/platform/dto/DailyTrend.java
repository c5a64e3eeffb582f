package com.salestracker.platform.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyTrend {
    private LocalDate date;
    private long total;

    @Builder.Default
    private Map<String, Long> types = new TreeMap<>();
}
